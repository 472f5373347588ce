package com.archiver.core.cache;

public record CreatorKey(String service, String creatorId) {
    @Override
    public String toString() {
        return service + "/" + creatorId;
    }
}
