package io.intellixity.datastore.spi;

/** Hands url-sourced table population to the asynchronous import pipeline. Fire-and-forget. */
@FunctionalInterface
public interface ImportTrigger {
  void submit(String resourceId);
}
