package com.relalg.expression;

import com.relalg.ast.CodeInfo;
import com.relalg.types.DataType;
import com.relalg.types.StringType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Expression applying an operator or function.
 *
 * <p>The function name selects the behavior, for example {@code =}, {@code and},
 * {@code +}, {@code upper} or {@code rownum}. The special function
 * {@code constant} denotes a literal: its single argument is the literal value
 * itself. For every other function the arguments are nested {@link ValueExpr}s.
 *
 * <p>Examples:
 * <pre>
 *   new GenericValueExpr(NumberType.get(), "constant", List.of(42))
 *   new GenericValueExpr(BooleanType.get(), "&gt;", List.of(column, constant))
 * </pre>
 */
public final class GenericValueExpr implements ValueExpr {

    /** Function name marking a literal. */
    public static final String CONSTANT = "constant";

    private static final Set<String> INFIX_OPERATORS = Set.of(
        "=", "!=", "<>", "<", "<=", ">", ">=",
        "and", "or", "xor",
        "+", "-", "*", "/", "%", "||", "like", "ilike");

    private final DataType dataType;
    private final String func;
    private final List<Object> args;
    private final CodeInfo codeInfo;
    private final boolean wrappedInParentheses;

    /**
     * Creates an operator or function application.
     *
     * @param dataType the result data type
     * @param func the function name
     * @param args literal values for {@code constant}, nested expressions otherwise
     * @param codeInfo the source position (may be null)
     * @param wrappedInParentheses whether the expression was parenthesized
     */
    public GenericValueExpr(DataType dataType, String func, List<?> args,
                            CodeInfo codeInfo, boolean wrappedInParentheses) {
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.func = Objects.requireNonNull(func, "func must not be null");
        this.args = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(args, "args must not be null")));
        this.codeInfo = codeInfo;
        this.wrappedInParentheses = wrappedInParentheses;

        if (!CONSTANT.equals(func)) {
            for (Object arg : this.args) {
                if (!(arg instanceof ValueExpr)) {
                    throw new IllegalArgumentException(
                        "arguments of '" + func + "' must be expressions, got: " + arg);
                }
            }
        }
    }

    /**
     * Creates an unpositioned operator or function application.
     *
     * @param dataType the result data type
     * @param func the function name
     * @param args literal values for {@code constant}, nested expressions otherwise
     */
    public GenericValueExpr(DataType dataType, String func, List<?> args) {
        this(dataType, func, args, null, false);
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    public String func() {
        return func;
    }

    /**
     * Returns the arguments.
     *
     * @return the literal values of a constant, or the nested expressions
     */
    public List<Object> args() {
        return args;
    }

    /**
     * Returns the argument at an index as an expression.
     *
     * @param index the argument index
     * @return the nested expression
     * @throws IllegalStateException if this is a constant
     */
    public ValueExpr arg(int index) {
        if (isConstant()) {
            throw new IllegalStateException("constants have no expression arguments");
        }
        return (ValueExpr) args.get(index);
    }

    public boolean isConstant() {
        return CONSTANT.equals(func);
    }

    @Override
    public CodeInfo codeInfo() {
        return codeInfo;
    }

    @Override
    public boolean wrappedInParentheses() {
        return wrappedInParentheses;
    }

    @Override
    public String format() {
        String text;
        if (isConstant()) {
            text = formatConstant();
        } else if (INFIX_OPERATORS.contains(func) && args.size() == 2) {
            text = arg(0).format() + " " + func + " " + arg(1).format();
        } else if ("not".equals(func) && args.size() == 1) {
            text = "not " + arg(0).format();
        } else {
            List<String> formatted = new ArrayList<>();
            for (int i = 0; i < args.size(); i++) {
                formatted.add(arg(i).format());
            }
            text = func + "(" + String.join(", ", formatted) + ")";
        }
        return wrappedInParentheses ? "(" + text + ")" : text;
    }

    private String formatConstant() {
        Object value = args.isEmpty() ? null : args.get(0);
        if (value == null) {
            return "null";
        }
        if (dataType instanceof StringType) {
            return "'" + value.toString().replace("'", "''") + "'";
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof GenericValueExpr)) return false;
        GenericValueExpr that = (GenericValueExpr) obj;
        return wrappedInParentheses == that.wrappedInParentheses &&
               Objects.equals(dataType, that.dataType) &&
               Objects.equals(func, that.func) &&
               Objects.equals(args, that.args) &&
               Objects.equals(codeInfo, that.codeInfo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataType, func, args, codeInfo, wrappedInParentheses);
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a literal.
     *
     * @param dataType the literal's type
     * @param value the literal value (may be null)
     * @return the constant expression
     */
    public static GenericValueExpr constant(DataType dataType, Object value) {
        return new GenericValueExpr(dataType, CONSTANT, Collections.singletonList(value));
    }

    /**
     * Creates an operator application without source position.
     *
     * @param dataType the result type
     * @param func the operator name
     * @param args the operands
     * @return the expression
     */
    public static GenericValueExpr call(DataType dataType, String func, ValueExpr... args) {
        return new GenericValueExpr(dataType, func, List.of(args));
    }
}
