package com.myorg.normcontrol.rules.predicate;

import com.myorg.normcontrol.model.Page;
import com.myorg.normcontrol.rules.RuleContext;
import com.myorg.normcontrol.rules.RulePredicate;

/**
 * Sheet numbers read from stamps must increase by exactly one in page order. Pages whose stamp
 * carries no sheet number are skipped; fewer than two numbers hold trivially.
 */
public final class SheetNumberingPredicate implements RulePredicate {

    @Override
    public boolean test(RuleContext context) {
        Integer previous = null;
        for (Page page : context.getPages()) {
            if (page.getStamp() == null || page.getStamp().getSheetNumber() == null) {
                continue;
            }
            int current = page.getStamp().getSheetNumber();
            if (previous != null && current != previous + 1) {
                return false;
            }
            previous = current;
        }
        return true;
    }
}
