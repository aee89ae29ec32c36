package com.hostprobe.core.diagnostics;

import com.hostprobe.core.exec.ExecutionProperties;
import com.hostprobe.core.logging.MdcContext;
import com.hostprobe.core.policy.PolicyStore;
import com.hostprobe.core.security.PathSandboxResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Single entry point for the CLI, REST and MCP surfaces. Routes each
 * {@link DiagnosticOperation} to the handler registered for its type and tags the call
 * with a request id in the MDC.
 */
@Service
public class DiagnosticDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticDispatcher.class);

    private final Map<Class<?>, Function<Object, Object>> handlers = new LinkedHashMap<>();

    public DiagnosticDispatcher(SafeCommandRunner commandRunner,
                                LogReader logReader,
                                EnvironmentInspector environmentInspector,
                                ProcessInspector processInspector,
                                NetworkProbe networkProbe,
                                PathSandboxResolver pathResolver,
                                PolicyStore policyStore,
                                ExecutionProperties executionProperties) {
        register(DiagnosticOperation.RunCommand.class, commandRunner::run);
        register(DiagnosticOperation.ReadLog.class, logReader::read);
        register(DiagnosticOperation.ListLogs.class, op -> logReader.listCommon());
        register(DiagnosticOperation.InspectEnvironment.class, environmentInspector::inspect);
        register(DiagnosticOperation.SearchProcesses.class, processInspector::search);
        register(DiagnosticOperation.TestConnectivity.class, networkProbe::probe);
        register(DiagnosticOperation.DescribePolicy.class, op -> PolicySummary.of(policyStore, executionProperties));
        register(DiagnosticOperation.CheckPath.class, op -> pathResolver.resolve(op.path()));
    }

    private <O extends DiagnosticOperation<R>, R> void register(Class<O> type, Function<O, R> handler) {
        handlers.put(type, op -> handler.apply(type.cast(op)));
    }

    /**
     * Runs the operation on the calling thread.
     *
     * @throws InvalidRequestException when the operation's parameters are out of range
     */
    public <R> R dispatch(DiagnosticOperation<R> operation) {
        Objects.requireNonNull(operation, "operation");
        Function<Object, Object> handler = handlers.get(operation.getClass());
        if (handler == null) {
            throw new IllegalStateException("No handler registered for " + operation.getClass().getSimpleName());
        }

        String requestId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setRequest(requestId, operation.operationName());
        try {
            log.debug("Dispatching {}", operation.operationName());
            @SuppressWarnings("unchecked")
            R result = (R) handler.apply(operation);
            return result;
        } catch (InvalidRequestException e) {
            log.info("Invalid {} request: {}", operation.operationName(), e.getMessage());
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    public Set<Class<?>> registeredOperations() {
        return handlers.keySet();
    }
}
