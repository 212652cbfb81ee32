package health.assist.api.model;

public record ApiError(boolean ok, String error) {
    public static ApiError of(String error) {
        return new ApiError(false, error);
    }
}
