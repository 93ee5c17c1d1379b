package com.expensetracker.common.exception;

import org.springframework.core.NestedExceptionUtils;

/**
 * 存储失败：底层数据库文件无法打开、读取或写入，或写入被存储引擎拒绝（如 NOT NULL 约束）。
 * 该异常对当前调用是致命的，内部不做重试；消息中带有最底层 SQL 异常的类型与信息，便于区分两类原因。
 */
public class StorageUnavailableException extends RuntimeException {

    private final String operation;

    public StorageUnavailableException(String operation, Throwable cause) {
        super(describe(operation, cause), cause);
        this.operation = operation;
    }

    /**
     * @return 失败的存储操作名称
     */
    public String getOperation() {
        return operation;
    }

    private static String describe(String operation, Throwable cause) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(cause);
        return "Expense storage operation " + operation + " failed ["
                + root.getClass().getSimpleName() + "]: " + root.getMessage();
    }
}
