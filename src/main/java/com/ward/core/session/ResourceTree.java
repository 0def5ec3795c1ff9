package com.ward.core.session;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assembles resources into a forest by parent id, and flattens it back.
 *
 * A resource whose parent is absent from the set becomes a root. Each level is ordered by
 * start time; equal start times keep input order.
 */
public final class ResourceTree {

    private static final Comparator<Resource> BY_START = Comparator.comparingDouble(Resource::startTime);

    private ResourceTree() {
    }

    public static List<Resource> build(List<Resource> resources) {
        Map<String, Resource> byId = new LinkedHashMap<>();
        for (Resource resource : resources) {
            byId.putIfAbsent(resource.id(), resource);
        }

        Map<String, List<Resource>> childrenByParent = new LinkedHashMap<>();
        List<Resource> roots = new ArrayList<>();
        for (Resource resource : byId.values()) {
            String parentId = resource.parentId();
            if (parentId != null && !parentId.equals(resource.id()) && byId.containsKey(parentId)) {
                childrenByParent.computeIfAbsent(parentId, id -> new ArrayList<>()).add(resource);
            } else {
                roots.add(resource);
            }
        }
        roots.sort(BY_START);

        Set<String> visited = new HashSet<>();
        List<Resource> result = new ArrayList<>(roots.size());
        for (Resource root : roots) {
            result.add(attachChildren(root, childrenByParent, visited));
        }

        // Members of a parent cycle are unreachable from any root
        if (visited.size() < byId.size()) {
            for (Resource resource : byId.values()) {
                if (!visited.contains(resource.id())) {
                    result.add(attachChildren(resource, childrenByParent, visited));
                }
            }
            result.sort(BY_START);
        }
        return result;
    }

    private static Resource attachChildren(Resource resource,
                                           Map<String, List<Resource>> childrenByParent,
                                           Set<String> visited) {
        visited.add(resource.id());
        List<Resource> children = childrenByParent.getOrDefault(resource.id(), List.of());

        List<Resource> attached = new ArrayList<>(children.size());
        for (Resource child : children) {
            if (!visited.contains(child.id())) {
                attached.add(attachChildren(child, childrenByParent, visited));
            }
        }
        attached.sort(BY_START);
        return resource.toBuilder().children(attached).build();
    }

    /**
     * Pre-order flattening: each resource is followed by its descendants.
     */
    public static List<Resource> flatten(List<Resource> roots) {
        List<Resource> result = new ArrayList<>();
        for (Resource root : roots) {
            collect(root, result);
        }
        return result;
    }

    private static void collect(Resource resource, List<Resource> result) {
        result.add(resource);
        for (Resource child : resource.children()) {
            collect(child, result);
        }
    }
}
