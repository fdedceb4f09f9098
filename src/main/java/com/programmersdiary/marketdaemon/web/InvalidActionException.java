package com.programmersdiary.marketdaemon.web;

public class InvalidActionException extends RuntimeException {

    public InvalidActionException(String message) {
        super(message);
    }
}
