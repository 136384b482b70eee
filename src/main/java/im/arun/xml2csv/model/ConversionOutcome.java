package im.arun.xml2csv.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * Result of handling one input document in batch or merge mode.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversionOutcome {

    public enum Status {
        CONVERTED,
        SKIPPED,
        FAILED
    }

    @JsonProperty("input")
    private String input;

    @JsonProperty("output")
    private String output;

    @JsonProperty("status")
    private Status status;

    @JsonProperty("rows")
    private Integer rowCount;

    @JsonProperty("columns")
    private Integer columnCount;

    @JsonProperty("message")
    private String message;

    public static ConversionOutcome converted(Path input, Path output, int rows, int columns) {
        return new ConversionOutcome(input.toString(), output == null ? null : output.toString(),
            Status.CONVERTED, rows, columns, null);
    }

    public static ConversionOutcome skipped(Path input, String reason) {
        return new ConversionOutcome(input.toString(), null, Status.SKIPPED, null, null, reason);
    }

    public static ConversionOutcome failed(Path input, String message) {
        return new ConversionOutcome(input.toString(), null, Status.FAILED, null, null, message);
    }

    public boolean isConverted() {
        return status == Status.CONVERTED;
    }
}
