package com.changesentinel.pipeline.notify;

public record DeliveryResult(boolean ok, String error) {
    private static final DeliveryResult OK = new DeliveryResult(true, null);

    public static DeliveryResult delivered() {
        return OK;
    }

    public static DeliveryResult failed(String error) {
        return new DeliveryResult(false, error);
    }
}
