package com.leadengine.test;

import com.leadengine.domain.conversation.service.ConversationEngineDomainService;
import com.leadengine.domain.followup.service.FollowupPolicyDomainService;
import com.leadengine.domain.lead.service.LeadIdentityDomainService;
import com.leadengine.domain.lead.service.LeadScoringDomainService;
import com.leadengine.domain.matching.service.PropertyMatchDomainService;
import com.leadengine.domain.session.service.SessionRoutingDomainService;
import com.leadengine.trigger.application.command.FollowupCampaignApplicationService;
import com.leadengine.trigger.application.command.FollowupCycleApplicationService;
import com.leadengine.trigger.application.command.InboundMessageApplicationService;
import com.leadengine.trigger.application.command.LeadPersistenceApplicationService;
import com.leadengine.trigger.application.command.LeadResolveApplicationService;
import com.leadengine.trigger.application.command.PropertyMatchNotifyApplicationService;
import com.leadengine.trigger.application.command.SessionRoutingApplicationService;
import com.leadengine.trigger.http.FollowupController;
import com.leadengine.trigger.http.InboundMessageController;
import com.leadengine.trigger.http.LeadController;
import com.leadengine.trigger.http.PropertyMatchController;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.annotation.Transactional;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;

public class ApplicationBoundaryTest {

    private static final List<Class<?>> CONTROLLERS = List.of(
            InboundMessageController.class,
            LeadController.class,
            PropertyMatchController.class,
            FollowupController.class
    );

    @Test
    public void applicationServicesShouldDependOnDomainServices() {
        Assertions.assertTrue(hasFieldType(InboundMessageApplicationService.class, ConversationEngineDomainService.class));
        Assertions.assertTrue(hasFieldType(SessionRoutingApplicationService.class, SessionRoutingDomainService.class));
        Assertions.assertTrue(hasFieldType(LeadResolveApplicationService.class, LeadIdentityDomainService.class));
        Assertions.assertTrue(hasFieldType(LeadPersistenceApplicationService.class, LeadScoringDomainService.class));
        Assertions.assertTrue(hasFieldType(FollowupCycleApplicationService.class, FollowupPolicyDomainService.class));
        Assertions.assertTrue(hasFieldType(FollowupCampaignApplicationService.class, FollowupPolicyDomainService.class));
        Assertions.assertTrue(hasFieldType(PropertyMatchNotifyApplicationService.class, PropertyMatchDomainService.class));
    }

    @Test
    public void controllersShouldNotDependOnDomainRepositoryPorts() {
        for (Class<?> controller : CONTROLLERS) {
            for (Field field : controller.getDeclaredFields()) {
                String typeName = field.getType().getName();
                Assertions.assertFalse(
                        typeName.contains(".domain") && typeName.contains(".adapter.repository."),
                        () -> "Controller should not inject repository port directly: " + controller.getSimpleName() + " -> " + typeName
                );
            }
        }
    }

    @Test
    public void leadWritesShouldRollBackOnAnyException() {
        for (Method method : LeadPersistenceApplicationService.class.getDeclaredMethods()) {
            if (!Modifier.isPublic(method.getModifiers()) || method.isSynthetic() || method.getName().startsWith("get")) {
                continue;
            }
            Transactional transactional = method.getAnnotation(Transactional.class);
            Assertions.assertNotNull(transactional, () -> "Missing @Transactional: " + method.getName());
            Assertions.assertTrue(Arrays.asList(transactional.rollbackFor()).contains(Exception.class),
                    () -> "rollbackFor should include Exception: " + method.getName());
        }
    }

    @Test
    public void channelSendsShouldRunOutsideTransactions() {
        for (Class<?> service : List.of(FollowupCycleApplicationService.class,
                FollowupCampaignApplicationService.class,
                PropertyMatchNotifyApplicationService.class)) {
            Assertions.assertNull(service.getAnnotation(Transactional.class), service.getSimpleName());
            for (Method method : service.getDeclaredMethods()) {
                Assertions.assertNull(method.getAnnotation(Transactional.class),
                        () -> service.getSimpleName() + "." + method.getName());
            }
        }
    }

    private boolean hasFieldType(Class<?> owner, Class<?> expectedType) {
        return Arrays.stream(owner.getDeclaredFields())
                .map(Field::getType)
                .anyMatch(type -> type.equals(expectedType));
    }
}
