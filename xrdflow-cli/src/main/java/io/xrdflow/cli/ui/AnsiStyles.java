package io.xrdflow.cli.ui;

/// ANSI text styling for CLI output with semantic color methods.
///
/// All methods return styled strings; output handling is the caller's responsibility.
///
/// ### Usage
/// ```java
/// AnsiStyles styles = AnsiStyles.of(true);  // color enabled
/// System.out.println(styles.checkmark() + " " + styles.bold("Scan processed"));
/// ```
///
/// @implNote **Thread-safe**. Instances are immutable after construction.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String GRAY = "\033[38;5;244m";
    private static final String DIM = "\033[38;5;241m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    /// Width of the frame separators printed around verbose plugin output.
    static final int RULE_WIDTH = 62;

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// Creates an AnsiStyles instance with specified color preference.
    ///
    /// @param useColor true to apply ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    // --- Text Formatting ---

    public String bold(String text) {
        return style(text, BOLD);
    }

    /// Applies gray color for secondary elements.
    public String gray(String text) {
        return style(text, GRAY);
    }

    public String dim(String text) {
        return style(text, DIM);
    }

    // --- Semantic Colors ---

    public String success(String text) {
        return style(text, GREEN);
    }

    public String error(String text) {
        return style(text, RED);
    }

    public String warn(String text) {
        return style(text, YELLOW);
    }

    /// Applies blue for plugin names and other highlights.
    public String accent(String text) {
        return style(text, BLUE);
    }

    /// Colors green on success, yellow on warning.
    public String successOrWarn(String text, boolean isSuccess) {
        return style(text, isSuccess ? GREEN : YELLOW);
    }

    // --- Symbols ---

    public String arrow() {
        return style("→", BLUE);
    }

    public String bullet() {
        return style("•", GRAY);
    }

    public String checkmark() {
        return style("✓", GREEN);
    }

    public String crossmark() {
        return style("✗", RED);
    }

    /// Branch connector in tree renderings: └─
    public String branch() {
        return style("└─", DIM);
    }

    // --- Separators ---

    /// Separator opening a block of verbose plugin output.
    public String separatorTop() {
        return rule('┌');
    }

    /// Separator closing a block of verbose plugin output.
    public String separatorBottom() {
        return rule('└');
    }

    private String rule(char corner) {
        return style(corner + "─".repeat(RULE_WIDTH - 1), DIM);
    }
}
