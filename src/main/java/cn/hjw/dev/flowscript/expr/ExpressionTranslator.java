package cn.hjw.dev.flowscript.expr;

import cn.hjw.dev.flowscript.diagnostic.Diagnostics;
import cn.hjw.dev.flowscript.diagnostic.Stage;
import cn.hjw.dev.flowscript.expr.ast.Expr;
import cn.hjw.dev.flowscript.model.ToolId;
import cn.hjw.dev.flowscript.script.PythonSyntax;
import cn.hjw.dev.flowscript.script.Requirement;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 公式翻译入口: 词法 -> 语法 -> 生成
 * 无状态, 可被多个转换并发使用
 */
@Slf4j
public class ExpressionTranslator {

    private final FunctionTable functions;

    public ExpressionTranslator() {
        this(FunctionTable.standard());
    }

    public ExpressionTranslator(FunctionTable functions) {
        this.functions = functions;
    }

    /**
     * @param formula       原始公式
     * @param frameVariable 列引用所在的 DataFrame 变量
     * @param toolId        警告归属的工具
     * @param diagnostics   警告收集器
     */
    public TranslatedExpression translate(String formula, String frameVariable, ToolId toolId, Diagnostics diagnostics) {
        Expr ast;
        try {
            ast = ExpressionParser.parse(formula);
        } catch (ExpressionSyntaxException e) {
            diagnostics.warn(Stage.GENERATE, toolId,
                    "Could not parse expression '" + formula + "': " + e.getMessage() + "; emitted placeholder");
            return new TranslatedExpression(
                    "unimplemented(" + PythonSyntax.string(formula) + ")",
                    ValueKind.UNKNOWN,
                    Collections.unmodifiableSet(EnumSet.of(Requirement.UNIMPLEMENTED_HELPER)),
                    Collections.emptyList(),
                    true);
        }

        ExpressionEmitter emitter = new ExpressionEmitter(functions, frameVariable, toolId, diagnostics);
        ExpressionEmitter.Emitted emitted = ast.accept(emitter);
        log.debug("Translated '{}' -> {}", formula, emitted.getCode());

        Set<Requirement> requirements = EnumSet.noneOf(Requirement.class);
        requirements.addAll(emitter.getRequirements());
        return new TranslatedExpression(
                emitted.getCode(),
                emitted.getKind(),
                Collections.unmodifiableSet(requirements),
                Collections.unmodifiableList(new ArrayList<>(emitter.getNotes())),
                emitter.isPlaceholder());
    }
}
