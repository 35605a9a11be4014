package dev.llumos.batch.fanout;

import dev.llumos.domain.entity.Organization;
import dev.llumos.domain.entity.Prompt;
import dev.llumos.domain.enums.LlmProvider;
import dev.llumos.domain.valueobject.Entitlement;
import dev.llumos.domain.valueobject.TaskKey;
import dev.llumos.exception.BatchConfigurationException;
import dev.llumos.exception.BatchValidationException;
import dev.llumos.repository.PromptRepository;
import dev.llumos.service.EntitlementService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands an organization's active prompts and entitled providers into tasks.
 * Prompts beyond the tier quota are left out, oldest prompts first in.
 */
@Component
public class TaskFanoutPlanner {

    private static final Logger log = LoggerFactory.getLogger(TaskFanoutPlanner.class);

    private final PromptRepository promptRepository;
    private final EntitlementService entitlementService;

    public TaskFanoutPlanner(PromptRepository promptRepository, EntitlementService entitlementService) {
        this.promptRepository = promptRepository;
        this.entitlementService = entitlementService;
    }

    public FanoutPlan plan(Organization org) {
        Entitlement entitlement = entitlementService.resolve(org);

        List<Prompt> prompts = promptRepository.findByOrgIdAndActiveTrueOrderByCreatedAtAsc(
                org.getId(), PageRequest.of(0, entitlement.promptLimit()));
        if (prompts.isEmpty()) {
            throw new BatchValidationException("Organization %s has no active prompts".formatted(org.getId()));
        }
        if (!entitlement.hasProviders()) {
            throw new BatchConfigurationException("No provider is both allowed by plan %s and configured"
                    .formatted(entitlement.tier()));
        }

        List<TaskKey> tasks = new ArrayList<>(prompts.size() * entitlement.providers().size());
        for (Prompt prompt : prompts) {
            for (LlmProvider provider : entitlement.providers()) {
                tasks.add(new TaskKey(prompt.getId(), provider));
            }
        }

        long active = promptRepository.countByOrgIdAndActiveTrue(org.getId());
        FanoutPlan plan = new FanoutPlan(org.getId(), entitlement.tier(),
                prompts.stream().map(Prompt::getId).toList(), entitlement.providers(), tasks, active);
        if (plan.isCapped()) {
            log.info("Org {} has {} active prompts; plan {} allows {}", org.getId(), active,
                    entitlement.tier(), entitlement.promptLimit());
        }
        return plan;
    }
}
