package sa.com.cloudsolutions.notifier.agent;

import net.bytebuddy.agent.ByteBuddyAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sa.com.cloudsolutions.notifier.weaver.WeaverOptions;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.instrument.Instrumentation;

/**
 * Java agent that weaves notifier classes as they are loaded, instead of rewriting a module on disk.
 *
 * The agent can be installed via premain/agentmain or programmatically by calling initialize().
 * Agent arguments follow {@link WeaverOptions#fromAgentArgs(String)}.
 */
public class NotifierAgent {
    private static final Logger logger = LoggerFactory.getLogger(NotifierAgent.class);

    private NotifierAgent() {}

    public static void premain(String agentArgs, Instrumentation inst) {
        install(agentArgs, inst);
    }

    public static void agentmain(String agentArgs, Instrumentation inst) {
        install(agentArgs, inst);
    }

    /**
     * Allows runtime installation without -javaagent by attaching a Byte Buddy agent to the current JVM.
     * Only classes loaded after this call are woven.
     */
    public static NotificationTransformer initialize(String agentArgs) {
        return install(agentArgs, ByteBuddyAgent.install());
    }

    private static NotificationTransformer install(String agentArgs, Instrumentation inst) {
        NotificationTransformer transformer;
        try {
            transformer = new NotificationTransformer(WeaverOptions.fromAgentArgs(agentArgs));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open notifier agent search path", e);
        }
        inst.addTransformer(transformer);
        logger.info("Notifier agent installed");
        return transformer;
    }
}
