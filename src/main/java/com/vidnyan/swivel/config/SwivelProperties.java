package com.vidnyan.swivel.config;

import com.vidnyan.swivel.domain.model.Severity;
import com.vidnyan.swivel.domain.model.ValidationDepth;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the validation pipeline.
 * Can be configured via application.yml or {@code --swivel.*} arguments.
 */
@Data
@Component
@ConfigurationProperties(prefix = "swivel")
public class SwivelProperties {

    private Sandbox sandbox = new Sandbox();

    private Healing healing = new Healing();

    private Analysis analysis = new Analysis();

    private Validate validate = new Validate();

    @Data
    public static class Sandbox {

        /**
         * Wall-clock limit for one sandbox run when the caller gives none.
         */
        private Duration timeout = Duration.ofSeconds(10);

        /**
         * Heap ceiling passed as {@code -Xmx}.
         */
        private String maxHeap = "256m";

        /**
         * Bytes of captured stdout/stderr read back after a run.
         */
        private int captureLimit = 64 * 1024;

        /**
         * Java launcher for sandbox runs. Default: the JDK running the tool
         */
        private String javaCommand;
    }

    @Data
    public static class Healing {

        private int maxIterations = 5;
    }

    @Data
    public static class Analysis {

        /**
         * Severity of E202, a blocking call on the event dispatch thread.
         */
        private Severity blockingCallSeverity = Severity.ERROR;
    }

    @Data
    public static class Validate {

        /**
         * Candidate source file. The CLI does nothing when unset.
         */
        private String path;

        private ValidationDepth depth = ValidationDepth.FULL;

        /**
         * Run the self-healing loop instead of a single validation.
         */
        private boolean heal;

        /**
         * Apply the correction rules once, without the sandbox tier.
         */
        private boolean fix;

        /**
         * File receiving the JSON document. Default: log only
         */
        private String output;

        /**
         * File receiving the healed or fixed source.
         */
        private String healedPath;

        /**
         * Print what is known about the Swing runtime and exit.
         */
        private boolean describe;
    }
}
