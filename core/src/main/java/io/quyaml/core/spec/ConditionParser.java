package io.quyaml.core.spec;

import io.quyaml.core.error.ConditionSemanticException;
import io.quyaml.core.model.ConditionExpr;
import io.quyaml.core.model.Register;
import java.math.BigInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses classical conditions into a {@link ConditionExpr} tree.
 *
 * <p>
 * {@code ||} binds loosest and {@code &&} tighter, both left-associative.
 * Leaves take one of two forms, both compared against the whole classical
 * register:
 * <ul>
 * <li>{@code c[i] == 0|1}, normalized to {@code c == (bit << i)}</li>
 * <li>{@code c == literal}, with decimal, {@code 0b} or {@code 0x} literals
 * and optional {@code _} separators</li>
 * </ul>
 * Parentheses are rejected.
 */
public final class ConditionParser {

    private static final Pattern BIT_ATOM =
            Pattern.compile("\\s*([A-Za-z_][A-Za-z0-9_]*)\\[(\\d+)]\\s*==\\s*([01])\\s*");
    private static final Pattern REGISTER_ATOM = Pattern.compile(
            "\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*==\\s*(0[bB][01_]+|0[xX][0-9a-fA-F_]+|\\d[\\d_]*)\\s*");

    private ConditionParser() {
        // utility class
    }

    /**
     * Parses a condition.
     *
     * @param text              condition text
     * @param line              1-based position of the owning instruction
     * @param classicalRegister declared classical register
     * @return the condition tree
     * @throws ConditionSemanticException on malformed atoms, empty operands,
     *                                    parentheses, foreign register names,
     *                                    out-of-range bits or values
     */
    public static ConditionExpr parse(String text, int line, Register classicalRegister) {
        String location = "line " + line;
        if (text == null || text.isBlank()) {
            throw new ConditionSemanticException("Empty condition string on line " + line + ".", location);
        }
        if (text.indexOf('(') >= 0 || text.indexOf(')') >= 0) {
            throw new ConditionSemanticException(
                    String.format("Parenthesized conditions are not supported: '%s' on line %d.", text.strip(), line),
                    location);
        }

        ConditionExpr node = null;
        for (String orPart : text.split("\\|\\|", -1)) {
            ConditionExpr conjunction = parseConjunction(orPart, text, line, classicalRegister);
            node = node == null ? conjunction : new ConditionExpr.Or(node, conjunction);
        }
        return node;
    }

    private static ConditionExpr parseConjunction(String part, String whole, int line, Register classicalRegister) {
        ConditionExpr node = null;
        for (String andPart : part.split("&&", -1)) {
            if (andPart.isBlank()) {
                throw new ConditionSemanticException(
                        String.format("Empty operand in condition '%s' on line %d.", whole.strip(), line),
                        "line " + line);
            }
            ConditionExpr atom = parseAtom(andPart, line, classicalRegister);
            node = node == null ? atom : new ConditionExpr.And(node, atom);
        }
        return node;
    }

    private static ConditionExpr.Atom parseAtom(String token, int line, Register classicalRegister) {
        String location = "line " + line;
        int width = classicalRegister.size();

        Matcher bit = BIT_ATOM.matcher(token);
        if (bit.matches()) {
            checkRegisterName(bit.group(1), token, line, classicalRegister);
            BigInteger index = new BigInteger(bit.group(2));
            if (index.compareTo(BigInteger.valueOf(width)) >= 0) {
                throw new ConditionSemanticException(
                        String.format(
                                "Condition references %s[%s] but circuit has %d bits.",
                                classicalRegister.name(), index, width),
                        location);
            }
            BigInteger value =
                    "1".equals(bit.group(3)) ? BigInteger.ONE.shiftLeft(index.intValueExact()) : BigInteger.ZERO;
            return new ConditionExpr.Atom(classicalRegister.name(), value);
        }

        Matcher register = REGISTER_ATOM.matcher(token);
        if (register.matches()) {
            checkRegisterName(register.group(1), token, line, classicalRegister);
            BigInteger value = parseLiteral(register.group(2), line);
            // value < 2^width
            if (value.bitLength() > width) {
                throw new ConditionSemanticException(
                        String.format("Condition value %s doesn't fit in %d classical bits.", value, width),
                        location);
            }
            return new ConditionExpr.Atom(classicalRegister.name(), value);
        }

        String name = classicalRegister.name();
        throw new ConditionSemanticException(
                String.format(
                        "Unsupported condition atom '%s' on line %d. Use '%s[i] == 0/1' or '%s == <int>'.",
                        token.strip(), line, name, name),
                location);
    }

    private static void checkRegisterName(String name, String token, int line, Register classicalRegister) {
        if (!name.equals(classicalRegister.name())) {
            throw new ConditionSemanticException(
                    String.format(
                            "Condition '%s' on line %d references register '%s', but the classical register is '%s'.",
                            token.strip(), line, name, classicalRegister.name()),
                    "line " + line);
        }
    }

    private static BigInteger parseLiteral(String literal, int line) {
        String digits = literal.replace("_", "");
        int radix = 10;
        if (digits.length() > 1 && (digits.charAt(1) == 'b' || digits.charAt(1) == 'B')) {
            radix = 2;
            digits = digits.substring(2);
        } else if (digits.length() > 1 && (digits.charAt(1) == 'x' || digits.charAt(1) == 'X')) {
            radix = 16;
            digits = digits.substring(2);
        }
        if (digits.isEmpty()) {
            throw new ConditionSemanticException(
                    String.format("Invalid integer literal '%s' in condition on line %d.", literal, line),
                    "line " + line);
        }
        return new BigInteger(digits, radix);
    }
}
