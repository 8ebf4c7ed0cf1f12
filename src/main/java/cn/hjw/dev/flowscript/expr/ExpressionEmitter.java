package cn.hjw.dev.flowscript.expr;

import cn.hjw.dev.flowscript.diagnostic.Diagnostics;
import cn.hjw.dev.flowscript.diagnostic.Stage;
import cn.hjw.dev.flowscript.expr.ast.BinaryOp;
import cn.hjw.dev.flowscript.expr.ast.BinaryOperator;
import cn.hjw.dev.flowscript.expr.ast.Call;
import cn.hjw.dev.flowscript.expr.ast.Expr;
import cn.hjw.dev.flowscript.expr.ast.ExprVisitor;
import cn.hjw.dev.flowscript.expr.ast.FieldRef;
import cn.hjw.dev.flowscript.expr.ast.Literal;
import cn.hjw.dev.flowscript.expr.ast.UnaryOp;
import cn.hjw.dev.flowscript.expr.ast.UnaryOperator;
import cn.hjw.dev.flowscript.model.ToolId;
import cn.hjw.dev.flowscript.script.PythonSyntax;
import cn.hjw.dev.flowscript.script.Requirement;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 语法树 -> pandas 表达式
 * 每次翻译新建一个实例, 收集本次用到的前导项与说明
 */
class ExpressionEmitter implements ExprVisitor<ExpressionEmitter.Emitted> {

    private final FunctionTable functions;
    private final String frame;
    private final ToolId toolId;
    private final Diagnostics diagnostics;

    @Getter
    private final Set<Requirement> requirements = EnumSet.noneOf(Requirement.class);

    @Getter
    private final Set<String> notes = new LinkedHashSet<>();

    @Getter
    private boolean placeholder;

    ExpressionEmitter(FunctionTable functions, String frame, ToolId toolId, Diagnostics diagnostics) {
        this.functions = functions;
        this.frame = frame;
        this.toolId = toolId;
        this.diagnostics = diagnostics;
    }

    @Override
    public Emitted visitLiteral(Literal literal) {
        switch (literal.getKind()) {
            case NUMERIC:
                return new Emitted(PythonSyntax.number(literal.getValue()), ValueKind.NUMERIC, literal);
            case BOOLEAN:
                return new Emitted(PythonSyntax.bool(Boolean.parseBoolean(literal.getValue())), ValueKind.BOOLEAN, literal);
            default:
                return new Emitted(PythonSyntax.string(literal.getValue()), literal.getKind(), literal);
        }
    }

    @Override
    public Emitted visitFieldRef(FieldRef fieldRef) {
        return new Emitted(PythonSyntax.column(frame, fieldRef.getName()), ValueKind.UNKNOWN, null);
    }

    @Override
    public Emitted visitUnary(UnaryOp unary) {
        Emitted operand = unary.getOperand().accept(this);
        if (unary.getOperator() == UnaryOperator.NOT) {
            // 标量布尔上 ~True 是按位取反 (-2), 只能用 not
            if (operand.getLiteral() != null && operand.getKind() == ValueKind.BOOLEAN) {
                return new Emitted("(not " + operand.getCode() + ")", ValueKind.BOOLEAN, null);
            }
            return new Emitted("(~" + operand.getCode() + ")", ValueKind.BOOLEAN, null);
        }
        return new Emitted("(-" + operand.getCode() + ")", ValueKind.NUMERIC, null);
    }

    @Override
    public Emitted visitBinary(BinaryOp binary) {
        Emitted left = binary.getLeft().accept(this);
        Emitted right = binary.getRight().accept(this);
        BinaryOperator op = binary.getOperator();

        switch (op.getCategory()) {
            case LOGICAL:
                return new Emitted(wrap(left.getCode(), op, right.getCode()), ValueKind.BOOLEAN, null);
            case COMPARISON:
                String l = left.getCode();
                String r = right.getCode();
                if (left.getKind() == ValueKind.STRING && right.getKind() == ValueKind.NUMERIC) {
                    l = toNumeric(l);
                } else if (left.getKind() == ValueKind.NUMERIC && right.getKind() == ValueKind.STRING) {
                    r = toNumeric(r);
                }
                return new Emitted(wrap(l, op, r), ValueKind.BOOLEAN, null);
            default:
                return arithmetic(op, left, right);
        }
    }

    private Emitted arithmetic(BinaryOperator op, Emitted left, Emitted right) {
        if (op == BinaryOperator.ADD) {
            // 字符串 + 数值: 按字符串拼接, 数值一侧转字符串
            if (left.getKind() == ValueKind.STRING && right.getKind() == ValueKind.NUMERIC) {
                return new Emitted(wrap(left.getCode(), op, asText(right)), ValueKind.STRING, null);
            }
            if (left.getKind() == ValueKind.NUMERIC && right.getKind() == ValueKind.STRING) {
                return new Emitted(wrap(asText(left), op, right.getCode()), ValueKind.STRING, null);
            }
            if (left.getKind() == ValueKind.STRING || right.getKind() == ValueKind.STRING) {
                return new Emitted(wrap(left.getCode(), op, right.getCode()), ValueKind.STRING, null);
            }
        }
        return new Emitted(wrap(left.getCode(), op, right.getCode()), ValueKind.NUMERIC, null);
    }

    @Override
    public Emitted visitCall(Call call) {
        FunctionMapping mapping = functions.lookup(call.getName()).orElse(null);
        int arity = call.getArguments().size();
        if (mapping == null) {
            return unimplemented(call, "Function '" + call.getName() + "' has no translation");
        }
        if (!mapping.accepts(arity)) {
            return unimplemented(call, "Function '" + call.getName() + "' expects " + arityText(mapping)
                    + " argument(s) but got " + arity);
        }

        List<String> codes = new ArrayList<>();
        List<ValueKind> kinds = new ArrayList<>();
        for (Expr argument : call.getArguments()) {
            Emitted e = argument.accept(this);
            codes.add(e.getCode());
            kinds.add(e.getKind());
        }
        requirements.addAll(mapping.getRequirements());
        if (mapping.getNote() != null) {
            notes.add(mapping.getName() + ": " + mapping.getNote());
        }
        return new Emitted(mapping.render(codes), mapping.resultKind(kinds), null);
    }

    /**
     * 无法翻译的调用: 参数不再翻译, 每个调用恰好一条警告
     */
    private Emitted unimplemented(Call call, String reason) {
        diagnostics.warn(Stage.GENERATE, toolId, reason + "; emitted placeholder for " + call.getSource());
        requirements.add(Requirement.UNIMPLEMENTED_HELPER);
        placeholder = true;
        return new Emitted("unimplemented(" + PythonSyntax.string(call.getSource()) + ")", ValueKind.UNKNOWN, null);
    }

    private String toNumeric(String code) {
        requirements.add(Requirement.PANDAS);
        return "pd.to_numeric(" + code + ", errors='coerce')";
    }

    private static String asText(Emitted numeric) {
        if (numeric.getLiteral() != null) {
            return PythonSyntax.string(numeric.getLiteral().getValue());
        }
        return PythonSyntax.receiver(numeric.getCode()) + ".astype(str)";
    }

    private static String wrap(String left, BinaryOperator op, String right) {
        return "(" + left + " " + op.getTarget() + " " + right + ")";
    }

    private static String arityText(FunctionMapping mapping) {
        if (mapping.getMinArity() == mapping.getMaxArity()) {
            return String.valueOf(mapping.getMinArity());
        }
        if (mapping.getMaxArity() == FunctionMapping.VARIADIC) {
            return "at least " + mapping.getMinArity();
        }
        return mapping.getMinArity() + " to " + mapping.getMaxArity();
    }

    // literal 仅在节点本身是字面量时非空
    @Getter
    @RequiredArgsConstructor
    static final class Emitted {
        private final String code;
        private final ValueKind kind;
        private final Literal literal;
    }
}
