package com.scanforge.infrastructure.classification;

import com.scanforge.infrastructure.parsing.PyExpr;
import com.scanforge.infrastructure.parsing.PyStmt;

/**
 * A detection-rule assignment such as {@code df['lc_frontside_d2'] = (cond).astype(int)}.
 *
 * @param name              column name being assigned
 * @param frameName         name of the frame variable being subscripted, or null for complex receivers
 * @param condition         boolean expression (receiver of {@code .astype(...)} when present)
 * @param statement         the assignment statement
 * @param enclosingFunction top-level function containing the assignment, or null at module level
 */
public record PatternAssignment(
        String name,
        String frameName,
        PyExpr condition,
        PyStmt.Assign statement,
        String enclosingFunction
) {
}
