package org.erl2ex.codegen.backend.layout;

/**
 * Tags for the kinds of text the backend emits. Vertical spacing depends only
 * on the previous and next tag, see {@link SpacingPolicy}.
 */
public enum FormKind {
    /** Nothing has been written yet. */
    START,
    /** File-level comments and standalone comment blocks. */
    STRUCTURE_COMMENTS,
    /** Comments directly above the module envelope. */
    MODULE_COMMENTS,
    MODULE_BEGIN,
    MODULE_END,
    /** Leading comments of a function or macro. */
    FUNC_HEADER,
    FUNC_SPECS,
    FUNC_CLAUSE_FIRST,
    FUNC_CLAUSE,
    ATTR,
    DIRECTIVE
}
