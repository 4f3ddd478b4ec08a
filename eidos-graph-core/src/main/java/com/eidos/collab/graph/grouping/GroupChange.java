package com.eidos.collab.graph.grouping;

import java.util.List;

/**
 * A proposed group operation.
 *
 * @param action what to do
 * @param groupId target group; required for everything but {@link GroupAction#CREATE}, where it is
 *                an optional proposed id
 * @param parentConceptId representative concept, used by {@link GroupAction#CREATE}
 * @param childConceptIds children to group, add or remove
 * @param groupName optional display name
 * @param expectedVersion group version the client acted on, checked when present
 * @param clientRequestId opaque id echoed back in the committed event
 */
public record GroupChange(GroupAction action,
                          Long groupId,
                          Long parentConceptId,
                          List<Long> childConceptIds,
                          String groupName,
                          Long expectedVersion,
                          String clientRequestId) {

    public GroupChange {
        childConceptIds = childConceptIds == null ? List.of() : List.copyOf(childConceptIds);
    }

    public static GroupChange create(long parentConceptId, List<Long> childConceptIds) {
        return new GroupChange(GroupAction.CREATE, null, parentConceptId, childConceptIds, null, null, null);
    }

    public static GroupChange expand(long groupId) {
        return new GroupChange(GroupAction.EXPAND, groupId, null, List.of(), null, null, null);
    }

    public static GroupChange collapse(long groupId) {
        return new GroupChange(GroupAction.COLLAPSE, groupId, null, List.of(), null, null, null);
    }

    public static GroupChange delete(long groupId) {
        return new GroupChange(GroupAction.DELETE, groupId, null, List.of(), null, null, null);
    }

    public static GroupChange addChildren(long groupId, List<Long> childConceptIds) {
        return new GroupChange(GroupAction.ADD_CHILDREN, groupId, null, childConceptIds, null, null, null);
    }

    public static GroupChange removeChildren(long groupId, List<Long> childConceptIds) {
        return new GroupChange(GroupAction.REMOVE_CHILDREN, groupId, null, childConceptIds, null, null, null);
    }

    public GroupChange withClientRequestId(String requestId) {
        return new GroupChange(action, groupId, parentConceptId, childConceptIds, groupName, expectedVersion,
                requestId);
    }
}
