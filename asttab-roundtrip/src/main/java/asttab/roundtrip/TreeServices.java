package asttab.roundtrip;

import asttab.tree.TreeNode;

/// Operations that need a Python runtime: parsing source, unparsing trees and
/// executing rebuilt modules.
public interface TreeServices {

    /// Parses Python source into a `Module` tree.
    /// @throws SourceSyntaxException if the source does not parse
    TreeNode parseSource(String source);

    /// Renders a tree back to Python source.
    String unparse(TreeNode tree);

    /// Executes `module` in a fresh namespace seeded only from `bindings` and reports
    /// what `name` is bound to afterwards.
    /// @throws ReconstructionException if `name` is unbound or not callable
    ReconstructedCallable compileAndExecute(TreeNode module, String name, Bindings bindings);
}
