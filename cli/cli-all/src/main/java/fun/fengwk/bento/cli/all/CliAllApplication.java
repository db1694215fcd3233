package fun.fengwk.bento.cli.all;

import fun.fengwk.bento.core.mcp.BentoMcp;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * @author fengwk
 */

@SpringBootApplication(scanBasePackages = "fun.fengwk.bento")
public class CliAllApplication {

    public static void main(String[] args) {
        SpringApplication.run(CliAllApplication.class, args);
    }

    @Bean
    @ConditionalOnProperty(prefix = "spring.ai.mcp.server", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ToolCallbackProvider bentoTools(BentoMcp bentoMcp) {
        return MethodToolCallbackProvider.builder()
            .toolObjects(bentoMcp)
            .build();
    }

}
