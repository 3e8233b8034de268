package com.p6tree.factory;

import com.p6tree.ast.Bareword;
import com.p6tree.ast.BinaryNumber;
import com.p6tree.ast.DecimalNumber;
import com.p6tree.ast.Element;
import com.p6tree.ast.FloatingPointNumber;
import com.p6tree.ast.HexadecimalNumber;
import com.p6tree.ast.Infinity;
import com.p6tree.ast.NotANumber;
import com.p6tree.ast.NumberLiteral;
import com.p6tree.ast.OctalNumber;
import com.p6tree.ast.RadixNumber;
import com.p6tree.match.Match;
import com.p6tree.match.Shape;

/**
 * Literal values: numbers, quotes and versions.
 */
final class ValueRules extends RuleSet {

    ValueRules(Rules rules) {
        super(rules);
    }

    Element value(Match p) {
        Shape shape = shape(p);
        if (shape.is("number")) {
            return number(p.get("number"));
        }
        if (shape.is("quote")) {
            return rules.quotes.quote(p.get("quote"));
        }
        if (shape.is("version")) {
            return version(p.get("version"));
        }
        throw unhandled("value", p);
    }

    /** {@code v6}, {@code v6.c}, {@code v1.2.3}. */
    Bareword version(Match p) {
        return adapter.fromMatch(Bareword::new, p);
    }

    NumberLiteral number(Match p) {
        if (shape(p).is("numish")) {
            return numish(p.get("numish"));
        }
        throw unhandled("number", p);
    }

    private NumberLiteral numish(Match p) {
        Shape shape = shape(p);
        if (shape.is("integer")) {
            return integer(p.get("integer"));
        }
        if (shape.is("dec_number")) {
            return decNumber(p.get("dec_number"));
        }
        if (shape.is("rad_number")) {
            return radNumber(p.get("rad_number"));
        }
        if (shape.isBare()) {
            String text = p.str();
            if (text.equals("NaN")) {
                return adapter.fromMatch(NotANumber::new, p);
            }
            if (text.equals("Inf") || text.equals("∞")) {
                return adapter.fromMatch(Infinity::new, p);
            }
        }
        throw unhandled("numish", p);
    }

    private NumberLiteral integer(Match p) {
        Shape shape = shape(p);
        if (shape.is("binint", "VALUE")) {
            return adapter.fromMatch(BinaryNumber::new, p);
        }
        if (shape.is("octint", "VALUE")) {
            return adapter.fromMatch(OctalNumber::new, p);
        }
        if (shape.is("hexint", "VALUE")) {
            return adapter.fromMatch(HexadecimalNumber::new, p);
        }
        if (shape.is("decint", "VALUE")) {
            return adapter.fromMatch(DecimalNumber::new, p);
        }
        throw unhandled("integer", p);
    }

    /** {@code 1.5}, {@code .5}, {@code 1e10}, {@code 1.5e-3}. */
    private NumberLiteral decNumber(Match p) {
        Shape shape = shape(p);
        if (shape.isOptionally(keys("coeff", "escale"), "int", "frac")) {
            return adapter.fromMatch(FloatingPointNumber::new, p);
        }
        if (shape.is("int", "coeff", "frac") || shape.is("coeff", "frac")) {
            return adapter.fromMatch(DecimalNumber::new, p);
        }
        throw unhandled("dec_number", p);
    }

    /** {@code :16<FF>}, {@code :2<1010>}, {@code :10<1.5*10**3>}. */
    private NumberLiteral radNumber(Match p) {
        Shape shape = shape(p);
        if (shape.is("radix", "circumfix")
            || shape.isOptionally(keys("radix", "intpart"), "fracpart", "base", "exp")
            || shape.isOptionally(keys("radix", "fracpart"), "base", "exp")) {
            int radix;
            try {
                radix = Integer.parseInt(p.get("radix").str());
            } catch (NumberFormatException e) {
                throw unhandled("rad_number", p);
            }
            String text = p.str();
            return adapter.stamp(new RadixNumber(p.from(), p.to(), text, radix));
        }
        throw unhandled("rad_number", p);
    }
}
