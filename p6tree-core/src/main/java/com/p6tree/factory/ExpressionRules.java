package com.p6tree.factory;

import com.p6tree.ast.Adverb;
import com.p6tree.ast.Bareword;
import com.p6tree.ast.Block;
import com.p6tree.ast.Element;
import com.p6tree.ast.ImaginaryNumber;
import com.p6tree.ast.NumberLiteral;
import com.p6tree.ast.Operator;
import com.p6tree.ast.Semicolon;
import com.p6tree.match.Match;
import com.p6tree.match.Shape;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Expressions: operators and their operands, terms, brackets, method calls and
 * argument lists.
 *
 * <p>An operator expression yields its operands and operators as siblings, so
 * {@code 1 + 2} becomes three elements rather than one nested node. The grammar
 * does not always give infix operators a usable range, so they are located in
 * the source text between the operands already built.</p>
 */
final class ExpressionRules extends RuleSet {

    private static final Pattern OPERATOR_TEXT = Pattern.compile("\\S+");
    private static final Pattern TERNARY_THEN = Pattern.compile("\\?\\?");
    private static final Pattern TERNARY_ELSE = Pattern.compile("!!");

    ExpressionRules(Rules rules) {
        super(rules);
    }

    // ========================================================================
    // EXPR
    // ========================================================================

    List<Element> expr(Match p) {
        Shape shape = shape(p);
        if (shape.is("infix_circumfix_meta_operator", "OPER")) {
            return hyper(p);
        }
        if (shape.is("infix", "OPER")) {
            Match infix = p.get("infix");
            if (infix.get("EXPR") != null) {
                return ternary(p);
            }
            return infix(p);
        }
        if (shape.is("prefix", "OPER")) {
            return prefix(p);
        }
        if (shape.is("postfix", "OPER")) {
            return postfix(p);
        }
        if (shape.is("postcircumfix", "OPER")) {
            List<Element> children = operands(p, "postcircumfix");
            children.add(postcircumfix(p.get("postcircumfix")));
            return children;
        }
        if (shape.is("dotty", "OPER")) {
            List<Element> children = operands(p, "dotty");
            children.addAll(dotty(p.get("dotty")));
            return children;
        }
        if (shape.is("prefix_circumfix_meta_operator", "OPER")) {
            return reduction(p);
        }
        return term(p, shape);
    }

    /** The single operand of a unary operator expression. */
    private List<Element> operands(Match p, String rule) {
        if (p.list().size() != 1) {
            throw unhandled(rule, p);
        }
        return new ArrayList<>(expr(p.list().get(0)));
    }

    /**
     * Binary and list-associative operators: {@code a + b}, {@code 1, 2, 3}. The
     * operator sits where the {@code infix} capture says when that lies between
     * the operands; otherwise its text is located in the gap between them.
     */
    private List<Element> infix(Match p) {
        List<Match> terms = p.list();
        if (terms.size() < 2) {
            throw unhandled("EXPR:infix", p);
        }
        Match infix = p.get("infix");
        List<Element> children = new ArrayList<>(expr(terms.get(0)));
        for (int i = 1; i < terms.size(); i++) {
            List<Element> right = expr(terms.get(i));
            children.add(operator(Operator.Infix::new, end(children, p.from()), start(right, terms.get(i).from()), infix));
            children.addAll(right);
        }
        return children;
    }

    private List<Element> ternary(Match p) {
        List<Match> terms = p.list();
        if (terms.size() != 2) {
            throw unhandled("EXPR:ternary", p);
        }
        List<Element> children = new ArrayList<>(expr(terms.get(0)));
        List<Element> then = expr(p.get("infix").get("EXPR"));
        List<Element> otherwise = expr(terms.get(1));
        children.add(locate(Operator.Infix::new, end(children, p.from()), start(then, p.to()), TERNARY_THEN));
        children.addAll(then);
        children.add(locate(Operator.Infix::new, end(then, p.from()), start(otherwise, p.to()), TERNARY_ELSE));
        children.addAll(otherwise);
        return children;
    }

    /** {@code @a >>+<< @b}, {@code @a «~» @b}. */
    private List<Element> hyper(Match p) {
        List<Match> terms = p.list();
        if (terms.size() != 2) {
            throw unhandled("EXPR:hyper", p);
        }
        Match meta = p.get("infix_circumfix_meta_operator");
        List<Element> children = new ArrayList<>(expr(terms.get(0)));
        List<Element> right = expr(terms.get(1));
        children.add(operator(Operator.Hyper::new, end(children, p.from()), start(right, p.to()), meta));
        children.addAll(right);
        return children;
    }

    private List<Element> prefix(Match p) {
        List<Element> children = new ArrayList<>();
        children.add(adapter.fromMatchTrimmed(Operator.Prefix::new, p.get("prefix")));
        children.addAll(operands(p, "EXPR:prefix"));
        return children;
    }

    /** {@code $i++}; a number followed by postfix {@code i} is an imaginary number. */
    private List<Element> postfix(Match p) {
        List<Element> children = operands(p, "EXPR:postfix");
        Match postfix = p.get("postfix");
        if (postfix.str().equals("i") && children.size() == 1 && children.get(0) instanceof NumberLiteral number
            && number.to() == postfix.from()) {
            return List.of(adapter.fromRange(ImaginaryNumber::new, number.from(), postfix.to()));
        }
        children.add(adapter.fromMatchTrimmed(Operator.Postfix::new, postfix));
        return children;
    }

    /** {@code [+] @list}. */
    private List<Element> reduction(Match p) {
        List<Element> children = new ArrayList<>();
        children.add(adapter.fromMatchTrimmed(Operator.Prefix::new, p.get("prefix_circumfix_meta_operator")));
        for (Match term : p.list()) {
            children.addAll(expr(term));
        }
        return children;
    }

    /** The operator in {@code [from, to)}, preferring the range of its own capture. */
    private <T extends Element> T operator(MatchAdapter.LeafMaker<T> maker, int from, int to, Match capture) {
        T captured = adapter.fromMatchTrimmed(maker, capture);
        if (captured.from() < captured.to() && captured.from() >= from && captured.to() <= to) {
            return captured;
        }
        String token = capture.str().trim();
        if (!token.isEmpty()) {
            T element = adapter.find(maker, from, to, token);
            if (element != null) {
                return element;
            }
        }
        return locate(maker, from, to, OPERATOR_TEXT);
    }

    // ========================================================================
    // Terms
    // ========================================================================

    private List<Element> term(Match p, Shape shape) {
        if (shape.is("value")) {
            return List.of(rules.values.value(p.get("value")));
        }
        if (shape.is("variable")) {
            return List.of(rules.variables.variable(p.get("variable")));
        }
        if (shape.is("circumfix")) {
            return circumfix(p.get("circumfix"));
        }
        if (shape.is("scope_declarator")) {
            return rules.declarations.scopeDeclarator(p.get("scope_declarator"));
        }
        if (shape.is("multi_declarator")) {
            return rules.declarations.multiDeclarator(p.get("multi_declarator"));
        }
        if (shape.is("routine_declarator")) {
            return rules.routines.routineDeclarator(p.get("routine_declarator"));
        }
        if (shape.is("package_declarator")) {
            return rules.declarations.packageDeclarator(p.get("package_declarator"));
        }
        if (shape.is("regex_declarator")) {
            return rules.declarations.regexDeclarator(p.get("regex_declarator"));
        }
        if (shape.is("type_declarator")) {
            return rules.declarations.typeDeclarator(p.get("type_declarator"));
        }
        if (shape.is("statement_prefix")) {
            return rules.statements.statementPrefix(p.get("statement_prefix"));
        }
        if (shape.is("colonpair")) {
            return colonpair(p.get("colonpair"));
        }
        if (shape.is("fatarrow")) {
            return fatarrow(p.get("fatarrow"));
        }
        if (shape.is("identifier", "args")) {
            List<Element> children = new ArrayList<>();
            children.add(adapter.fromMatch(Bareword::new, p.get("identifier")));
            children.addAll(args(p.get("args")));
            return children;
        }
        if (shape.is("identifier")) {
            return List.of(adapter.fromMatch(Bareword::new, p.get("identifier")));
        }
        if (shape.is("longname", "args")) {
            List<Element> children = new ArrayList<>();
            children.add(rules.names.longname(p.get("longname")));
            children.addAll(args(p.get("args")));
            return children;
        }
        if (shape.is("longname")) {
            return List.of(rules.names.longname(p.get("longname")));
        }
        if (shape.is("pblock")) {
            return rules.statements.pblock(p.get("pblock"));
        }
        if (shape.is("sym")) {
            return List.of(adapter.fromMatchTrimmed(Bareword::new, p.get("sym")));
        }
        if (shape.isBare() && !p.str().isBlank()) {
            // self, now, *, ...
            return List.of(adapter.fromMatchTrimmed(Bareword::new, p));
        }
        throw unhandled("term", p);
    }

    // ========================================================================
    // Brackets
    // ========================================================================

    /** A bracketed term; its opening character decides what it becomes. */
    List<Element> circumfix(Match p) {
        Shape shape = shape(p);
        if (shape.is("pblock")) {
            return rules.statements.pblock(p.get("pblock"));
        }
        char open = p.to() > p.from() ? orig.charAt(p.from()) : ' ';
        if (open == '<' || open == '«') {
            if (shape.is("nibble") || shape.isBare()) {
                return List.of(rules.quotes.wordList(p));
            }
        } else if (open == '(' || open == '[') {
            if (shape.is("semilist")) {
                return List.of(adapter.balanced(Operator.Circumfix::new, p,
                    rules.statements.semilist(p.get("semilist"))));
            }
            if (shape.isBare()) {
                return List.of(adapter.balanced(Operator.Circumfix::new, p, List.of()));
            }
        } else if (open == '{') {
            if (shape.is("semilist")) {
                return List.of(adapter.balanced(Block::new, p, rules.statements.semilist(p.get("semilist"))));
            }
            if (shape.isBare()) {
                return List.of(adapter.balanced(Block::new, p, List.of()));
            }
        }
        throw unhandled("circumfix", p);
    }

    /** Subscripts and call arguments: {@code [0]}, {@code {$k}}, {@code <k>}, {@code (1, 2)}. */
    Operator.PostCircumfix postcircumfix(Match p) {
        Shape shape = shape(p);
        String text = p.str();
        if (text.startsWith("[") || text.startsWith("{")) {
            if (shape.is("semilist")) {
                return adapter.balanced(Operator.PostCircumfix::new, p, rules.statements.semilist(p.get("semilist")));
            }
            if (shape.isBare()) {
                return adapter.balanced(Operator.PostCircumfix::new, p, List.of());
            }
        } else if (text.startsWith("(")) {
            if (shape.is("arglist")) {
                return adapter.balanced(Operator.PostCircumfix::new, p, arglist(p.get("arglist")));
            }
            if (shape.isBare()) {
                return adapter.balanced(Operator.PostCircumfix::new, p, List.of());
            }
        } else if (shape.is("nibble") || shape.isBare()) {
            String front = text.startsWith("<<") ? "<<" : text.substring(0, 1);
            String back = front.equals("<<") ? ">>" : front.equals("«") ? "»" : ">";
            if (!text.endsWith(back)) {
                throw unhandled("postcircumfix", p);
            }
            List<Element> children = new ArrayList<>();
            Match nibble = p.get("nibble");
            if (nibble != null) {
                children.add(rules.quotes.wordListBody(nibble, front));
            }
            return adapter.balanced(Operator.PostCircumfix::new, p, front, back, children);
        }
        throw unhandled("postcircumfix", p);
    }

    // ========================================================================
    // Method calls
    // ========================================================================

    /** {@code .foo}, {@code .foo(1)}, {@code .=new}, {@code .^name}. */
    List<Element> dotty(Match p) {
        if (shape(p).is("sym", "dottyop")) {
            List<Element> children = new ArrayList<>();
            children.add(adapter.fromMatch(Operator.Infix::new, p.get("sym")));
            children.addAll(dottyop(p.get("dottyop")));
            return children;
        }
        throw unhandled("dotty", p);
    }

    private List<Element> dottyop(Match p) {
        if (shape(p).is("methodop")) {
            return methodop(p.get("methodop"));
        }
        throw unhandled("dottyop", p);
    }

    private List<Element> methodop(Match p) {
        Shape shape = shape(p);
        List<Element> children = new ArrayList<>();
        if (shape.is("longname", "args")) {
            children.add(adapter.fromMatch(Bareword::new, p.get("longname")));
            children.addAll(args(p.get("args")));
        } else if (shape.is("longname")) {
            children.add(adapter.fromMatch(Bareword::new, p.get("longname")));
        } else if (shape.is("identifier", "args")) {
            children.add(adapter.fromMatch(Bareword::new, p.get("identifier")));
            children.addAll(args(p.get("args")));
        } else if (shape.is("identifier")) {
            children.add(adapter.fromMatch(Bareword::new, p.get("identifier")));
        } else {
            throw unhandled("methodop", p);
        }
        return children;
    }

    // ========================================================================
    // Arguments
    // ========================================================================

    /** Arguments of a call: parenthesized, after a colon, or a bare list. */
    List<Element> args(Match p) {
        Shape shape = shape(p);
        if (shape.is("semiarglist")) {
            Match semiarglist = p.get("semiarglist");
            int open = skipWhitespace(p.from());
            if (open < p.to() && orig.charAt(open) == '(') {
                int close = skipWhitespaceBack(p.to());
                return List.of(adapter.balanced(Operator.PostCircumfix::new, open, close, semiarglist(semiarglist)));
            }
            return semiarglist(semiarglist);
        }
        if (shape.is("arglist")) {
            Match arglist = p.get("arglist");
            List<Element> children = new ArrayList<>();
            int colon = skipWhitespace(p.from());
            if (colon < arglist.from() && orig.charAt(colon) == ':') {
                children.add(adapter.fromInt(Operator.Infix::new, colon, ":"));
            }
            children.addAll(arglist(arglist));
            return children;
        }
        if (shape.isBare()) {
            String text = p.str().trim();
            if (text.equals("()")) {
                int open = orig.indexOf('(', p.from());
                return List.of(adapter.balanced(Operator.PostCircumfix::new, open, open + 2, List.of()));
            }
            return List.of();
        }
        throw unhandled("args", p);
    }

    /** Argument lists separated by semicolons. */
    List<Element> semiarglist(Match p) {
        Shape shape = shape(p);
        if (shape.is("arglist")) {
            List<Element> children = new ArrayList<>();
            for (Match arglist : p.getAll("arglist")) {
                List<Element> arguments = arglist(arglist);
                if (!children.isEmpty()) {
                    int at = start(arguments, arglist.from());
                    children.add(locate(Semicolon::new, end(children, p.from()), at, ";"));
                }
                children.addAll(arguments);
            }
            return children;
        }
        if (shape.isBare()) {
            return List.of();
        }
        throw unhandled("semiarglist", p);
    }

    List<Element> arglist(Match p) {
        Shape shape = shape(p);
        if (shape.is("EXPR")) {
            return expr(p.get("EXPR"));
        }
        if (shape.isBare()) {
            return List.of();
        }
        throw unhandled("arglist", p);
    }

    // ========================================================================
    // Pairs
    // ========================================================================

    /** {@code :foo}, {@code :!foo}, {@code :foo(1)}, {@code :$foo}. */
    List<Element> colonpair(Match p) {
        Shape shape = shape(p);
        if (shape.is("identifier")) {
            return List.of(adapter.fromMatchTrimmed(Adverb::new, p));
        }
        if (shape.is("identifier", "coloncircumfix")) {
            List<Element> children = new ArrayList<>();
            children.add(adapter.fromRange(Adverb::new, p.from(), p.get("identifier").to()));
            children.addAll(coloncircumfix(p.get("coloncircumfix")));
            return children;
        }
        if (shape.is("var")) {
            List<Element> children = new ArrayList<>();
            children.add(locate(Operator.Prefix::new, p.from(), p.get("var").from(), ":"));
            children.add(rules.variables.variable(p.get("var")));
            return children;
        }
        throw unhandled("colonpair", p);
    }

    private List<Element> coloncircumfix(Match p) {
        if (shape(p).is("circumfix")) {
            return circumfix(p.get("circumfix"));
        }
        throw unhandled("coloncircumfix", p);
    }

    /** {@code key => value}. */
    List<Element> fatarrow(Match p) {
        if (shape(p).is("key", "val")) {
            List<Element> children = new ArrayList<>();
            Bareword key = adapter.fromMatch(Bareword::new, p.get("key"));
            children.add(key);
            List<Element> value = expr(p.get("val"));
            children.add(locate(Operator.Infix::new, key.to(), start(value, p.to()), "=>"));
            children.addAll(value);
            return children;
        }
        throw unhandled("fatarrow", p);
    }
}
