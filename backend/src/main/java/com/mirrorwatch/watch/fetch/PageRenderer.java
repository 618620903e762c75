package com.mirrorwatch.watch.fetch;

public interface PageRenderer {
    /**
     * Returns the rendered markup of the page at {@code url}.
     *
     * @throws RenderException when the page could not be rendered; carries a reason code
     */
    String render(String url);
}
