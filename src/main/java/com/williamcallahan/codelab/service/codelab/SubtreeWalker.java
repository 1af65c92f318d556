package com.williamcallahan.codelab.service.codelab;

import com.williamcallahan.codelab.domain.codelab.node.CodelabNode;

import java.util.List;

/**
 * Recursive entry point handed to node builders that need to collect the nodes of a subtree.
 */
@FunctionalInterface
interface SubtreeWalker {

    /**
     * Parses the children of the current cursor. Moves the cursor, so callers wrap the call in a
     * {@link WalkContext#descend} scope.
     *
     * @param context walk state
     * @return nodes collected from the children, in document order
     */
    List<CodelabNode> parseSubtree(WalkContext context);
}
