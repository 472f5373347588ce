package com.archiver.api;

import com.archiver.common.model.PostRef;

/**
 * A site posts can be archived from (e.g. kemono). Registered with the Kernel by a plugin.
 */
public interface PostSource {

    /**
     * Short unique name, e.g. "kemono". Ends up in {@link PostRef#source()}.
     */
    String getName();

    /**
     * Whether {@code url} points at this site.
     */
    boolean supports(String url);

    /**
     * Splits a post URL into its service, creator id and post id.
     *
     * @throws IllegalArgumentException if the URL is not a post URL of this site
     */
    PostRef parse(String url);

    MetadataClient getMetadataClient();
}
