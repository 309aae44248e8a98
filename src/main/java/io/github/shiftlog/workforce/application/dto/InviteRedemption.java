package io.github.shiftlog.workforce.application.dto;

/**
 * Who redeems an invite: an existing employee, or an external (Telegram) identity.
 * Exactly one of the two is set.
 */
public record InviteRedemption(Long employeeId, String telegramUserId) {

    public static InviteRedemption forEmployee(Long employeeId) {
        return new InviteRedemption(employeeId, null);
    }

    public static InviteRedemption forTelegramUser(String telegramUserId) {
        return new InviteRedemption(null, telegramUserId);
    }

    public boolean byEmployee() {
        return employeeId != null;
    }
}
