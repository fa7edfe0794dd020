package com.flamingo.ai.docextract.service.extraction.layout;

import com.flamingo.ai.docextract.service.extraction.model.PageImage;

/** Image super-resolution used to give a layout provider a second, sharper look at a page. */
public interface ImageUpscaler {

  /**
   * Returns the page with an upscaled image.
   *
   * @throws com.flamingo.ai.docextract.exception.ProviderCallException if upscaling fails
   */
  PageImage upscale(PageImage page, int scale);
}
