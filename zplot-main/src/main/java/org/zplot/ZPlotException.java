package org.zplot;

public class ZPlotException extends RuntimeException {

    public ZPlotException(String message) {
        super(message);
    }
}
