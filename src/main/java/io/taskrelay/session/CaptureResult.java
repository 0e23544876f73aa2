package io.taskrelay.session;

public record CaptureResult(
        boolean captured,
        String output,
        String error
) {
    public static CaptureResult ok(String output) {
        return new CaptureResult(true, output == null ? "" : output, null);
    }

    public static CaptureResult fail(String error) {
        return new CaptureResult(false, "", error);
    }
}
