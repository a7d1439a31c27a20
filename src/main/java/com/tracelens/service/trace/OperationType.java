package com.tracelens.service.trace;

/**
 * Coarse classification of a span by its operation name, used to tailor recommendations.
 */
enum OperationType {
    CACHE,
    DATABASE,
    MESSAGING,
    HTTP,
    OTHER;

    static OperationType classify(String operationName) {
        if (operationName == null) {
            return OTHER;
        }
        String op = operationName.toLowerCase();

        if (op.contains("redis") || op.contains("cache") || op.contains("memcache")) {
            return CACHE;
        }

        // Database/JPA operations
        if (op.startsWith("db.") || op.contains("sql") || op.contains("query") || op.contains("select")
                || op.contains("insert") || op.contains("repository") || op.contains("dao")
                || op.contains("jpa") || op.contains("jdbc") || op.contains("mongo")
                || op.contains("findby") || op.contains("findall") || op.contains("spanner")) {
            return DATABASE;
        }

        if (op.contains("kafka") || op.contains("pubsub") || op.contains("publish") || op.contains("queue")
                || op.contains("consume")) {
            return MESSAGING;
        }

        // HTTP/REST operations
        if (op.startsWith("get ") || op.startsWith("post ") || op.startsWith("put ") || op.startsWith("delete ")
                || op.contains("http") || op.contains("rest") || op.contains("grpc") || op.contains("client")
                || op.contains("webclient") || op.contains("feign")) {
            return HTTP;
        }

        return OTHER;
    }
}
