package io.playengine.template;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Renders {@code {{ expression }}} placeholders for credential injector templates.
 * <p>
 * An expression is a variable name or quoted string, followed by any number of {@code .attr} lookups
 * or whitelisted no-argument string calls ({@code .upper()}, {@code .lower()}, {@code .strip()}),
 * followed by any number of {@code | filter}s ({@code upper}, {@code lower}, {@code trim}).
 * Map values expose their keys as attributes. Nothing else is evaluated: undefined names, unknown
 * attributes and block tags all raise {@link TemplateException}.
 */
public final class TemplateRenderer {
    private static final Map<String, UnaryOperator<String>> STRING_METHODS = Map.of(
            "upper", s -> s.toUpperCase(Locale.ROOT),
            "lower", s -> s.toLowerCase(Locale.ROOT),
            "strip", String::strip
    );
    private static final Map<String, UnaryOperator<String>> FILTERS = Map.of(
            "upper", s -> s.toUpperCase(Locale.ROOT),
            "lower", s -> s.toLowerCase(Locale.ROOT),
            "trim", String::strip
    );

    public String render(String template, Map<String, ?> scope) throws TemplateException {
        if (template == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(template.length());
        int pos = 0;
        while (pos < template.length()) {
            int open = template.indexOf('{', pos);
            if (open < 0 || open == template.length() - 1) {
                out.append(template, pos, template.length());
                break;
            }
            char next = template.charAt(open + 1);
            if (next == '%' || next == '#') {
                throw new TemplateException("unsupported template tag '{" + next + "' at offset " + open);
            }
            if (next != '{') {
                out.append(template, pos, open + 1);
                pos = open + 1;
                continue;
            }
            int close = template.indexOf("}}", open + 2);
            if (close < 0) {
                throw new TemplateException("unexpected end of template, expected '}}' after offset " + open);
            }
            out.append(template, pos, open);
            Object value = evaluate(template.substring(open + 2, close), scope);
            out.append(stringify(value));
            pos = close + 2;
        }
        return out.toString();
    }

    /** Root variable names the template reads, in order of first use. */
    public Set<String> referencedVariables(String template) throws TemplateException {
        Set<String> names = new LinkedHashSet<>();
        if (template == null) {
            return names;
        }
        int pos = 0;
        while (true) {
            int open = template.indexOf("{{", pos);
            if (open < 0) {
                return names;
            }
            int close = template.indexOf("}}", open + 2);
            if (close < 0) {
                throw new TemplateException("unexpected end of template, expected '}}' after offset " + open);
            }
            Expression expression = new Parser(template.substring(open + 2, close)).parse();
            if (expression.rootName() != null) {
                names.add(expression.rootName());
            }
            pos = close + 2;
        }
    }

    private Object evaluate(String source, Map<String, ?> scope) throws TemplateException {
        Expression expression = new Parser(source).parse();
        Object value;
        if (expression.rootName() != null) {
            if (!scope.containsKey(expression.rootName())) {
                throw new TemplateException("'" + expression.rootName() + "' is undefined");
            }
            value = scope.get(expression.rootName());
        } else {
            value = expression.literal();
        }
        for (Step step : expression.steps()) {
            value = apply(step, value);
        }
        for (String filter : expression.filters()) {
            UnaryOperator<String> fn = FILTERS.get(filter);
            if (fn == null) {
                throw new TemplateException("no filter named '" + filter + "'");
            }
            value = fn.apply(stringify(value));
        }
        return value;
    }

    private static Object apply(Step step, Object target) throws TemplateException {
        if (target instanceof Map<?, ?> map) {
            if (step.call() || !map.containsKey(step.name())) {
                throw new TemplateException("'dict object' has no attribute '" + step.name() + "'");
            }
            return map.get(step.name());
        }
        if (target instanceof String s) {
            UnaryOperator<String> method = STRING_METHODS.get(step.name());
            if (method == null) {
                throw new TemplateException("'str object' has no attribute '" + step.name() + "'");
            }
            if (!step.call()) {
                throw new TemplateException("'" + step.name() + "' must be called on 'str object'");
            }
            return method.apply(s);
        }
        String typeName = target == null ? "None" : target.getClass().getSimpleName().toLowerCase(Locale.ROOT);
        throw new TemplateException("'" + typeName + " object' has no attribute '" + step.name() + "'");
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private record Step(String name, boolean call) {
    }

    private record Expression(String rootName, String literal, List<Step> steps, List<String> filters) {
    }

    private static final class Parser {
        private final String source;
        private int pos;

        private Parser(String source) {
            this.source = source;
        }

        private Expression parse() throws TemplateException {
            skipSpace();
            String rootName = null;
            String literal = null;
            if (peek() == '\'' || peek() == '"') {
                literal = stringLiteral();
            } else {
                rootName = identifier();
            }
            List<Step> steps = new ArrayList<>();
            List<String> filters = new ArrayList<>();
            skipSpace();
            while (peek() == '.') {
                pos++;
                String name = identifier();
                boolean call = false;
                skipSpace();
                if (peek() == '(') {
                    pos++;
                    skipSpace();
                    if (peek() != ')') {
                        throw new TemplateException("arguments are not supported in '" + source.strip() + "'");
                    }
                    pos++;
                    call = true;
                    skipSpace();
                }
                steps.add(new Step(name, call));
            }
            while (peek() == '|') {
                pos++;
                skipSpace();
                filters.add(identifier());
                skipSpace();
            }
            if (pos != source.length()) {
                throw new TemplateException("unexpected '" + source.charAt(pos) + "' in expression '" + source.strip() + "'");
            }
            return new Expression(rootName, literal, List.copyOf(steps), List.copyOf(filters));
        }

        private String identifier() throws TemplateException {
            skipSpace();
            int start = pos;
            if (pos < source.length() && (Character.isLetter(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
                while (pos < source.length()
                        && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                    pos++;
                }
            }
            if (start == pos) {
                throw new TemplateException("expected a name in expression '" + source.strip() + "'");
            }
            String name = source.substring(start, pos);
            skipSpace();
            return name;
        }

        private String stringLiteral() throws TemplateException {
            char quote = source.charAt(pos++);
            int end = source.indexOf(quote, pos);
            if (end < 0) {
                throw new TemplateException("unterminated string in expression '" + source.strip() + "'");
            }
            String value = source.substring(pos, end);
            pos = end + 1;
            skipSpace();
            return value;
        }

        private char peek() {
            return pos < source.length() ? source.charAt(pos) : '\0';
        }

        private void skipSpace() {
            while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
                pos++;
            }
        }
    }
}
