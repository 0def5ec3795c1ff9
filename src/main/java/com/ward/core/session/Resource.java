package com.ward.core.session;

import com.ward.core.span.SpanOrigin;
import com.ward.core.span.SpanStatus;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A span reinterpreted as a typed, tree-positioned unit of work within a session.
 *
 * Children are an owned, immutable copy; a resource never references live span state.
 */
@Builder(toBuilder = true)
public record Resource(
        String id,
        String parentId,
        String sessionId,
        String projectId,
        ResourceType type,
        SpanOrigin origin,
        String name,
        String url,
        double startTime,
        double endTime,
        double duration,
        SpanStatus status,
        Integer statusCode,
        Long size,
        boolean cached,
        String initiator,
        List<Resource> children,
        Map<String, Object> attributes
) {

    public Resource {
        children = children == null ? List.of() : List.copyOf(children);
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        if (url == null) {
            url = "";
        }
    }

    public boolean isServer() {
        return origin == SpanOrigin.SERVER;
    }

    public boolean isError() {
        return status == SpanStatus.ERROR;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * The URL when one was recorded, otherwise the span name.
     */
    public String urlOrName() {
        return url.isEmpty() ? name : url;
    }
}
