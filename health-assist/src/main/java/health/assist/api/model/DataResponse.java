package health.assist.api.model;

public record DataResponse<T>(boolean ok, T data) {
    public static <T> DataResponse<T> of(T data) {
        return new DataResponse<>(true, data);
    }
}
