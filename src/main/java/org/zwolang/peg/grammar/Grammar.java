package org.zwolang.peg.grammar;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.zwolang.error.SyntaxError;
import org.zwolang.error.ZwomError;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A complete PEG grammar - rules plus the optional {@code %whitespace} directive.
 * The first rule is the start rule.
 */
public record Grammar(List<Rule> rules, Map<String, Rule> ruleMap, Option<Expression> whitespace) {

    public static Grammar grammar(List<Rule> rules, Option<Expression> whitespace) {
        var byName = rules.stream()
                          .collect(Collectors.toUnmodifiableMap(Rule::name, Function.identity(), (first, second) -> first));
        return new Grammar(List.copyOf(rules), byName, whitespace);
    }

    public Option<Rule> rule(String name) {
        return Option.of(ruleMap.get(name));
    }

    public Option<Rule> startRule() {
        return rules.isEmpty()
               ? Option.none()
               : Option.some(rules.get(0));
    }

    /**
     * Check the grammar for duplicate rule names and undefined references.
     */
    public Either<ZwomError, Grammar> validate() {
        if (ruleMap.size() != rules.size()) {
            var duplicate = rules.stream()
                                 .filter(rule -> ruleMap.get(rule.name()) != rule)
                                 .findFirst()
                                 .orElseThrow();
            return Either.left(new SyntaxError.InvalidLiteral(duplicate.span()
                                                                       .start(),
                                                              "Duplicate rule: '" + duplicate.name() + "'"));
        }
        var names = ruleMap.keySet();
        for (var rule : rules) {
            var undefined = findUndefinedReference(rule.expression(), names);
            if (undefined.isDefined()) {
                var ref = undefined.get();
                return Either.left(new SyntaxError.InvalidLiteral(ref.span()
                                                                     .start(),
                                                                  "Undefined rule reference: '" + ref.ruleName() + "'"));
            }
        }
        for (var expr : whitespace) {
            var undefined = findUndefinedReference(expr, names);
            if (undefined.isDefined()) {
                return Either.left(new SyntaxError.InvalidLiteral(undefined.get()
                                                                           .span()
                                                                           .start(),
                                                                  "Undefined rule reference in %whitespace: '"
                                                                  + undefined.get()
                                                                             .ruleName() + "'"));
            }
        }
        return Either.right(this);
    }

    private static Option<Expression.Reference> findUndefinedReference(Expression root, Set<String> names) {
        var pending = new ArrayDeque<Expression>();
        pending.push(root);
        while (!pending.isEmpty()) {
            var expr = pending.pop();
            if (expr instanceof Expression.Reference ref && !names.contains(ref.ruleName())) {
                return Option.some(ref);
            }
            var children = Expression.children(expr);
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return Option.none();
    }
}
