package com.feedery.core.render;

import java.io.IOException;

/**
 * Consumer of a finished run's output. Templating into HTML or Atom lives behind this interface.
 */
public interface EntryRenderer {

    /**
     * Render the merged entries. Implementations must not mutate the model.
     */
    void render(RenderModel model) throws IOException;
}
