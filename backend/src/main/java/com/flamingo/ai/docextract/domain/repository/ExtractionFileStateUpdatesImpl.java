package com.flamingo.ai.docextract.domain.repository;

import com.flamingo.ai.docextract.domain.entity.ExtractionFile;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaUpdate;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Root;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import org.springframework.transaction.annotation.Transactional;

public class ExtractionFileStateUpdatesImpl implements ExtractionFileStateUpdates {

  @PersistenceContext private EntityManager entityManager;

  @Override
  @Transactional
  public int updateColumns(UUID id, Map<String, Object> changes) {
    CriteriaBuilder cb = entityManager.getCriteriaBuilder();
    CriteriaUpdate<ExtractionFile> update = cb.createCriteriaUpdate(ExtractionFile.class);
    Root<ExtractionFile> root = update.from(ExtractionFile.class);
    changes.forEach((attribute, value) -> assign(cb, update, root.get(attribute), value));
    update.set(root.<LocalDateTime>get("updatedAt"), LocalDateTime.now());
    update.where(cb.equal(root.get("id"), id));
    return entityManager.createQuery(update).executeUpdate();
  }

  private static <Y> void assign(
      CriteriaBuilder cb, CriteriaUpdate<ExtractionFile> update, Path<Y> path, Object value) {
    if (value == null) {
      update.set(path, cb.nullLiteral(path.getJavaType()));
    } else {
      update.set(path, path.getJavaType().cast(value));
    }
  }
}
