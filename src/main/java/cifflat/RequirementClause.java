package cifflat;

/**
 * One expanded {@code requirement invariant <guard> disables <event>} line.
 *
 * @param sourceIndex index of the requirement statement this clause was expanded from
 */
public record RequirementClause(GuardExpr guard, int disabledEvent, int sourceIndex) {}
