package fun.fengwk.bento.core.mcp;

import org.springframework.ai.tool.execution.ToolCallResultConverter;

import java.lang.reflect.Type;

/**
 * Search tools return rendered text, which is passed to the client as is.
 *
 * @author fengwk
 */
public class TextToolCallResultConverter implements ToolCallResultConverter {

    @Override
    public String convert(Object result, Type returnType) {
        if (result == null) {
            return "";
        }
        if (result instanceof CharSequence text) {
            return text.toString();
        }
        throw new IllegalStateException("tool result is not text: " + result.getClass().getName());
    }

}
