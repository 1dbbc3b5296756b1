package com.assuranceledger.subjects;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process subject registry.
 *
 * Subjects are registered by the collaborator that owns them. With
 * {@code assurance-ledger.subjects.accept-unregistered=true} every well-formed reference
 * resolves, which suits deployments where the caller has already validated subjects.
 */
@Component
@Slf4j
public class InMemorySubjectRegistry implements SubjectRegistry {

    private final Map<String, Set<SubjectRef>> subjectsByTenant = new ConcurrentHashMap<>();

    @Value("${assurance-ledger.subjects.accept-unregistered:false}")
    private boolean acceptUnregistered;

    public void register(String tenantId, SubjectRef subject) {
        subjectsByTenant.computeIfAbsent(tenantId, t -> ConcurrentHashMap.newKeySet()).add(subject);
        log.debug("Registered subject {} for tenant {}", subject, tenantId);
    }

    public void unregister(String tenantId, SubjectRef subject) {
        Set<SubjectRef> subjects = subjectsByTenant.get(tenantId);
        if (subjects != null) {
            subjects.remove(subject);
        }
    }

    @Override
    public boolean exists(String tenantId, SubjectRef subject) {
        if (acceptUnregistered) {
            return true;
        }
        Set<SubjectRef> subjects = subjectsByTenant.get(tenantId);
        return subjects != null && subjects.contains(subject);
    }
}
