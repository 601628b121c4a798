package com.lexinsight.llmjob.service.llm;

import com.lexinsight.llmjob.dto.llm.InvocationRequest;
import com.lexinsight.llmjob.dto.llm.InvocationResult;
import com.lexinsight.llmjob.exception.ChainTriggerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Runs chained invocations on the chain executor, fire-and-forget.
 */
@Component
@Slf4j
public class AsyncChainTrigger implements ChainTrigger {

    private final TaskExecutor chainExecutor;
    private final ObjectProvider<LlmJobPollerService> pollerService;

    public AsyncChainTrigger(@Qualifier("chainExecutor") TaskExecutor chainExecutor,
                             ObjectProvider<LlmJobPollerService> pollerService) {
        this.chainExecutor = chainExecutor;
        this.pollerService = pollerService;
    }

    @Override
    public void trigger(int chainDepth) {
        try {
            chainExecutor.execute(() -> {
                InvocationResult result = pollerService.getObject().invoke(new InvocationRequest(chainDepth));
                log.info("Chained invocation at depth {} finished with status {}", chainDepth, result.statusCode());
            });
        } catch (TaskRejectedException e) {
            throw new ChainTriggerException(chainDepth, e);
        }
    }
}
