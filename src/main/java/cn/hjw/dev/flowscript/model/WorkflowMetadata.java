package cn.hjw.dev.flowscript.model;

import lombok.Builder;
import lombok.Getter;

// 文档级元信息, 全部可为 null
@Getter
@Builder
public class WorkflowMetadata {

    public static final WorkflowMetadata EMPTY = WorkflowMetadata.builder().build();

    private final String version;
    private final String name;
    private final String author;
    private final String description;
}
