package com.flamingo.ai.docextract.service.extraction.block;

/** Pauses the calling thread between retries. */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD_SLEEP = Thread::sleep;

  void sleep(long millis) throws InterruptedException;
}
