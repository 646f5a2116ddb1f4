package io.intellixity.datastore.spi.handle;

/**
 * Maps a connection url chosen by the action layer to a live {@link EngineHandle}.\n
 *
 * Implementations typically pool one client per url.\n
 */
@FunctionalInterface
public interface EngineHandleResolver<H extends EngineHandle<?>> {
  H resolve(String connectionUrl);
}
