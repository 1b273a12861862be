package com.orderflow.contracts;

public final class Topics {
    private Topics() {}

    public static final String ORDER_CREATE = "order-create";
    public static final String ORDER_UPDATE = "order-update";
    public static final String ORDER_DELETE = "order-delete";

    public static final String DLQ_SUFFIX = "-dlq";
    public static final String ORDER_CREATE_DLQ = ORDER_CREATE + DLQ_SUFFIX;
    public static final String ORDER_UPDATE_DLQ = ORDER_UPDATE + DLQ_SUFFIX;
    public static final String ORDER_DELETE_DLQ = ORDER_DELETE + DLQ_SUFFIX;
    public static final String CATCH_ALL_DLQ = "order-events-dlq";
}
