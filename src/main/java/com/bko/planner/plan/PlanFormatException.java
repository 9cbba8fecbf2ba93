package com.bko.planner.plan;

public class PlanFormatException extends RuntimeException {

    public PlanFormatException(String message) {
        super(message);
    }

    public PlanFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
