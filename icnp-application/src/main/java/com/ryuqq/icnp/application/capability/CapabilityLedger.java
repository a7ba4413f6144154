package com.ryuqq.icnp.application.capability;

import com.ryuqq.icnp.application.audit.AuditLog;
import com.ryuqq.icnp.application.session.Session;
import com.ryuqq.icnp.application.session.SessionStore;
import com.ryuqq.icnp.core.audit.AuditEventKind;
import com.ryuqq.icnp.core.capability.Capability;
import com.ryuqq.icnp.core.capability.CapabilityAction;
import com.ryuqq.icnp.core.error.IcnpErrorCode;
import com.ryuqq.icnp.core.error.IcnpException;
import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.statemachine.SessionPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 참여자별 능력 원장.
 *
 * <p>추가만 가능합니다. 같은 id로 동일한 능력을 다시 공개하면 무시하고,
 * 다른 내용이면 capability_mismatch로 거절합니다. 한 메시지의 능력 목록은
 * 전부 기록되거나 전혀 기록되지 않습니다. 첫 공개는 세션을
 * intent에서 capability 단계로 옮깁니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class CapabilityLedger {

    private static final Logger log = LoggerFactory.getLogger(CapabilityLedger.class);

    private final SessionStore sessionStore;
    private final AuditLog auditLog;

    public CapabilityLedger(SessionStore sessionStore, AuditLog auditLog) {
        if (sessionStore == null || auditLog == null) {
            throw new IllegalArgumentException("sessionStore and auditLog cannot be null");
        }
        this.sessionStore = sessionStore;
        this.auditLog = auditLog;
    }

    /**
     * 능력 공개.
     *
     * @param session 세션 (락 보유 필요)
     * @param participant 공개 참여자
     * @param capability 능력
     * @return 새로 추가되었으면 true, 동일한 재공개이면 false
     * @throws IcnpException 단계 위반 또는 내용이 다른 재공개 (capability_mismatch)
     */
    public boolean disclose(Session session, Actor participant, Capability capability) {
        return discloseAll(session, participant, List.of(capability)) == 1;
    }

    /**
     * 여러 능력을 한 번에 공개.
     *
     * <p>모든 항목을 먼저 검사하고, 하나라도 거절되면 아무것도 기록하지 않습니다.</p>
     *
     * @param session 세션 (락 보유 필요)
     * @param participant 공개 참여자
     * @param capabilities 능력 목록
     * @return 새로 추가된 능력 수
     * @throws IcnpException 단계 위반 또는 내용이 다른 재공개 (capability_mismatch)
     */
    public int discloseAll(Session session, Actor participant, List<Capability> capabilities) {
        session.requireWriter();
        SessionPhase phase = session.phase();
        if (phase != SessionPhase.INTENT && phase != SessionPhase.CAPABILITY) {
            throw new IcnpException(IcnpErrorCode.CAPABILITY_MISMATCH,
                "capability disclosure is closed in phase " + phase.wireName());
        }
        if (session.intent() == null) {
            throw new IcnpException(IcnpErrorCode.INVALID_INTENT,
                "no intent recorded for session " + session.id().getValue());
        }

        Map<String, Capability> fresh = new LinkedHashMap<>();
        for (Capability capability : capabilities) {
            if (!capability.ownerId().equals(participant.id())) {
                throw new IcnpException(IcnpErrorCode.CAPABILITY_MISMATCH,
                    "capability " + capability.capabilityId() + " is owned by " + capability.ownerId()
                        + ", not " + participant.id());
            }
            Capability known = session.capability(participant.id(), capability.capabilityId())
                .orElse(fresh.get(capability.capabilityId()));
            if (known == null) {
                fresh.put(capability.capabilityId(), capability);
            } else if (known.equals(capability)) {
                log.debug("Identical capability re-disclosed: {} by {}", capability.capabilityId(), participant.id());
            } else {
                throw new IcnpException(IcnpErrorCode.CAPABILITY_MISMATCH,
                    "capability " + capability.capabilityId() + " was already disclosed with different content");
            }
        }
        if (fresh.isEmpty()) {
            return 0;
        }

        session.addParticipant(participant);
        for (Capability capability : fresh.values()) {
            session.addCapability(capability);
            auditLog.record(AuditEventKind.CAPABILITY_DISCLOSED, session.id(),
                List.of(participant.id(), capability.capabilityId()),
                AuditLog.details(
                    "capability_id", capability.capabilityId(),
                    "owner", participant.id(),
                    "actions", capability.actions().stream().map(CapabilityAction::action).collect(Collectors.joining(","))));
        }

        if (phase == SessionPhase.INTENT) {
            sessionStore.transition(session, SessionPhase.CAPABILITY);
        }
        return fresh.size();
    }

    /**
     * 능력 조회.
     *
     * @param session 세션
     * @param capabilityId 능력 ID
     * @return 능력, 없으면 empty
     */
    public Optional<Capability> lookup(Session session, String capabilityId) {
        return session.findCapability(capabilityId);
    }

    /**
     * 특정 참여자가 공개한 능력 조회.
     *
     * @param session 세션
     * @param ownerId 소유 참여자
     * @param capabilityId 능력 ID
     * @return 능력, 없으면 empty
     */
    public Optional<Capability> lookup(Session session, String ownerId, String capabilityId) {
        return session.capability(ownerId, capabilityId);
    }
}
