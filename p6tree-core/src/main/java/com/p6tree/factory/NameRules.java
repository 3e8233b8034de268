package com.p6tree.factory;

import com.p6tree.ast.Adverb;
import com.p6tree.ast.Bareword;
import com.p6tree.ast.Element;
import com.p6tree.ast.Operator;
import com.p6tree.ast.PackageName;
import com.p6tree.match.Match;
import com.p6tree.match.Shape;

import java.util.ArrayList;
import java.util.List;

/**
 * Names. A qualified name ({@code Foo::Bar}) or one that starts with an upper
 * case letter is taken to name a package; anything else is a bareword.
 */
final class NameRules extends RuleSet {

    NameRules(Rules rules) {
        super(rules);
    }

    /** {@code longname} and {@code deflongname}. */
    Element longname(Match p) {
        String text = p.str();
        if (text.isEmpty()) {
            throw unhandled("longname", p);
        }
        if (isPackageName(text)) {
            return adapter.fromMatch(PackageName::new, p);
        }
        return adapter.fromMatch(Bareword::new, p);
    }

    static boolean isPackageName(String text) {
        return text.contains("::") || Character.isUpperCase(text.codePointAt(0));
    }

    /** A type: {@code Int}, {@code Str:D}, {@code Array[Int]}. */
    List<Element> typename(Match p) {
        Shape shape = shape(p);
        List<Element> children = new ArrayList<>();
        if (shape.is("longname")) {
            children.add(adapter.fromMatch(PackageName::new, p.get("longname")));
            return children;
        }
        if (shape.is("longname", "colonpair")) {
            children.add(adapter.fromMatch(PackageName::new, p.get("longname")));
            for (Match colonpair : p.getAll("colonpair")) {
                children.add(adapter.fromMatchTrimmed(Adverb::new, colonpair));
            }
            return children;
        }
        if (shape.is("longname", "arglist")) {
            children.add(adapter.fromMatch(PackageName::new, p.get("longname")));
            Match arglist = p.get("arglist");
            int open = skipWhitespaceBack(arglist.from()) - 1;
            int close = skipWhitespace(arglist.to());
            if (open < 0 || orig.charAt(open) != '[' || close >= orig.length() || orig.charAt(close) != ']') {
                throw unhandled("typename", p);
            }
            children.add(adapter.balanced(Operator.PostCircumfix::new, open, close + 1,
                rules.expressions.arglist(arglist)));
            return children;
        }
        throw unhandled("typename", p);
    }
}
