package io.taskrelay.session;

public record DeliveryResult(
        boolean delivered,
        String error
) {
    public static DeliveryResult ok() {
        return new DeliveryResult(true, null);
    }

    public static DeliveryResult fail(String error) {
        return new DeliveryResult(false, error);
    }
}
