package cn.hjw.dev.flowscript.generator;

import cn.hjw.dev.flowscript.generator.tools.AppendFieldsGenerator;
import cn.hjw.dev.flowscript.generator.tools.BrowseGenerator;
import cn.hjw.dev.flowscript.generator.tools.CommentGenerator;
import cn.hjw.dev.flowscript.generator.tools.CrossTabGenerator;
import cn.hjw.dev.flowscript.generator.tools.FilterGenerator;
import cn.hjw.dev.flowscript.generator.tools.FormulaGenerator;
import cn.hjw.dev.flowscript.generator.tools.InputDataGenerator;
import cn.hjw.dev.flowscript.generator.tools.JoinGenerator;
import cn.hjw.dev.flowscript.generator.tools.MultiFieldFormulaGenerator;
import cn.hjw.dev.flowscript.generator.tools.OutputDataGenerator;
import cn.hjw.dev.flowscript.generator.tools.RecordIdGenerator;
import cn.hjw.dev.flowscript.generator.tools.SampleGenerator;
import cn.hjw.dev.flowscript.generator.tools.SelectGenerator;
import cn.hjw.dev.flowscript.generator.tools.SortGenerator;
import cn.hjw.dev.flowscript.generator.tools.SummarizeGenerator;
import cn.hjw.dev.flowscript.generator.tools.TextInputGenerator;
import cn.hjw.dev.flowscript.generator.tools.TextToColumnsGenerator;
import cn.hjw.dev.flowscript.generator.tools.TransposeGenerator;
import cn.hjw.dev.flowscript.generator.tools.UniqueGenerator;
import cn.hjw.dev.flowscript.generator.tools.UnionGenerator;
import cn.hjw.dev.flowscript.generator.tools.UnsupportedToolGenerator;
import cn.hjw.dev.flowscript.model.ToolType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * ToolType -> ToolGenerator 分派表
 * 构造时校验每种类型都有生成器, 之后只读
 */
public final class ToolGenerators {

    private final Map<ToolType, ToolGenerator> generators;

    public ToolGenerators(Map<ToolType, ToolGenerator> generators) {
        EnumMap<ToolType, ToolGenerator> guarded = new EnumMap<>(ToolType.class);
        for (ToolType type : ToolType.values()) {
            ToolGenerator generator = generators.get(type);
            if (generator == null) {
                throw new IllegalStateException("No generator registered for tool type " + type);
            }
            guarded.put(type, new GuardedToolGenerator(generator));
        }
        this.generators = Collections.unmodifiableMap(guarded);
    }

    public static ToolGenerators standard() {
        Map<ToolType, ToolGenerator> m = new EnumMap<>(ToolType.class);
        m.put(ToolType.INPUT_DATA, new InputDataGenerator());
        m.put(ToolType.OUTPUT_DATA, new OutputDataGenerator());
        m.put(ToolType.TEXT_INPUT, new TextInputGenerator());
        m.put(ToolType.BROWSE, new BrowseGenerator());
        m.put(ToolType.SELECT, new SelectGenerator());
        m.put(ToolType.FILTER, new FilterGenerator());
        m.put(ToolType.FORMULA, new FormulaGenerator());
        m.put(ToolType.MULTI_FIELD_FORMULA, new MultiFieldFormulaGenerator());
        m.put(ToolType.SAMPLE, new SampleGenerator());
        m.put(ToolType.RECORD_ID, new RecordIdGenerator());
        m.put(ToolType.UNIQUE, new UniqueGenerator());
        m.put(ToolType.SORT, new SortGenerator());
        m.put(ToolType.JOIN, new JoinGenerator());
        m.put(ToolType.UNION, new UnionGenerator());
        m.put(ToolType.APPEND_FIELDS, new AppendFieldsGenerator());
        m.put(ToolType.TEXT_TO_COLUMNS, new TextToColumnsGenerator());
        m.put(ToolType.SUMMARIZE, new SummarizeGenerator());
        m.put(ToolType.CROSS_TAB, new CrossTabGenerator());
        m.put(ToolType.TRANSPOSE, new TransposeGenerator());
        CommentGenerator comment = new CommentGenerator();
        m.put(ToolType.COMMENT, comment);
        m.put(ToolType.CONTAINER, comment);
        m.put(ToolType.UNSUPPORTED, new UnsupportedToolGenerator());
        return new ToolGenerators(m);
    }

    public ToolGenerator forType(ToolType type) {
        return generators.get(type);
    }
}
