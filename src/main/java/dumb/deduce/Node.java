package dumb.deduce;

import java.util.List;

/**
 * A node of an immutable tree. Leaves have no children.
 */
public interface Node<T extends Node<T>> {

    List<T> children();

    default int childCount() {
        return children().size();
    }

    default boolean isLeaf() {
        return childCount() == 0;
    }
}
