package me.christianrobert.orapgroutines.transformer.model.statement;

/**
 * Position of an {@link OtherStatement} in the control structure of its block.
 *
 * <p>The statement list stays flat: {@code IF x THEN}, its branch statements and
 * {@code END IF;} are siblings. The role only drives indentation when rendering.
 */
public enum ControlRole {
    /** Plain statement */
    NONE,
    /** Opens a nested construct: IF ... THEN, LOOP, WHILE ... LOOP, FOR ... LOOP, CASE x */
    OPENS,
    /** Continues the current construct: ELSIF ... THEN, ELSE, WHEN ... THEN inside CASE */
    CONTINUES,
    /** Closes a construct: END IF; END LOOP; END CASE; */
    CLOSES,
    /** The EXCEPTION keyword of a block */
    EXCEPTION_SECTION,
    /** WHEN ... THEN of an exception handler */
    HANDLER,
    /** {@code <<label>>} */
    LABEL
}
