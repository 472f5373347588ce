package com.archiver.common.model;

/**
 * Account that owns posts on a site. One instance exists per (service, id) and is shared
 * by every post of that creator.
 */
public record Creator(
        String service,   // e.g. "patreon", "fanbox", "onlyfans"
        String id,
        String name
) {}
