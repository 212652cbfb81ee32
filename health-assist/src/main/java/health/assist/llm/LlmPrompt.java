package health.assist.llm;

public record LlmPrompt(
        String text,
        InlineImage image,
        double temperature
) {
    public static LlmPrompt text(String text, double temperature) {
        return new LlmPrompt(text, null, temperature);
    }

    public boolean hasImage() {
        return image != null;
    }

    public record InlineImage(String mimeType, String base64Data) {}
}
