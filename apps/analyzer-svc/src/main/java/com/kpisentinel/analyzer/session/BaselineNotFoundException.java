package com.kpisentinel.analyzer.session;

public class BaselineNotFoundException extends RuntimeException {

    private final String metric;

    public BaselineNotFoundException(String metric) {
        super("No baseline stored for metric " + metric + " this month");
        this.metric = metric;
    }

    public String metric() {
        return metric;
    }
}
