package com.vtb.attackflow.models;

import java.util.Locale;
import java.util.Optional;

/**
 * Тактики MITRE ATT&CK, для которых заданы нечеткие системы оценки
 */
public enum MitreTactic {
    RECONNAISSANCE("TA0043", "Reconnaissance"),
    RESOURCE_DEVELOPMENT("TA0042", "Resource Development"),
    INITIAL_ACCESS("TA0001", "Initial Access"),
    EXECUTION("TA0002", "Execution"),
    PERSISTENCE("TA0003", "Persistence"),
    PRIVILEGE_ESCALATION("TA0004", "Privilege Escalation"),
    DEFENSE_EVASION("TA0005", "Defense Evasion"),
    CREDENTIAL_ACCESS("TA0006", "Credential Access"),
    DISCOVERY("TA0007", "Discovery"),
    LATERAL_MOVEMENT("TA0008", "Lateral Movement"),
    COLLECTION("TA0009", "Collection"),
    COMMAND_AND_CONTROL("TA0011", "Command and Control"),
    EXFILTRATION("TA0010", "Exfiltration"),
    IMPACT("TA0040", "Impact");

    private final String id;
    private final String displayName;

    MitreTactic(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Найти тактику по коду (TA0001...). Неизвестные коды не являются ошибкой
     */
    public static Optional<MitreTactic> fromId(String tacticId) {
        if (tacticId == null || tacticId.isBlank()) {
            return Optional.empty();
        }
        String normalized = tacticId.trim().toUpperCase(Locale.ROOT);
        for (MitreTactic tactic : values()) {
            if (tactic.id.equals(normalized)) {
                return Optional.of(tactic);
            }
        }
        return Optional.empty();
    }

    public static String nameOf(String tacticId) {
        return fromId(tacticId).map(MitreTactic::getDisplayName).orElse("Unknown");
    }
}
