package fun.fengwk.bento.core.result;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Error attached to a failed {@link ResultSet}.
 *
 * @author fengwk
 */
@Getter
@Builder
@ToString
public class SearchError {

    private final ErrorKind kind;

    /**
     * Human readable detail, when available.
     */
    private final String info;

    /**
     * Original exception, kept for diagnostics.
     */
    @ToString.Exclude
    private final Throwable cause;

    public static SearchError of(ErrorKind kind, String info) {
        return SearchError.builder()
            .kind(kind)
            .info(info)
            .build();
    }

    public static SearchError of(ErrorKind kind, Throwable cause) {
        return SearchError.builder()
            .kind(kind)
            .info(cause == null ? null : describe(cause))
            .cause(cause)
            .build();
    }

    /**
     * Info if present, otherwise the kind name.
     */
    public String getDescription() {
        return info == null || info.isBlank() ? kind.name() : kind.name() + ": " + info;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return cause.getClass().getSimpleName() + ": " + message;
    }

}
