package asttab.tree;

/// A value in a Python syntax tree: a node, a list or tuple of values, or a constant.
public sealed interface TreeValue permits TreeNode, TreeSequence, TreeConstant {
}
