package io.github.hotbrkm.smtpmail.simulator.smtp.policy;

import io.github.hotbrkm.smtpmail.simulator.smtp.properties.SimulatorSmtpProperties.Rejection;
import io.github.hotbrkm.smtpmail.simulator.smtp.util.EmailUtil;
import org.subethamail.smtp.RejectException;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Configured rejections, evaluated per SMTP phase.
 */
public class RejectionPolicy {

    private final List<Rejection> rejections;

    public RejectionPolicy(List<Rejection> rejections) {
        this.rejections = rejections == null ? List.of() : List.copyOf(rejections);
    }

    /**
     * Finds the first rejection configured for the phase whose matcher accepts the address.
     *
     * @param phase   current SMTP phase
     * @param address sender for MAIL FROM and DATA, recipient for RCPT TO
     */
    public Optional<Rejection> find(SmtpPhase phase, String address) {
        return rejections.stream()
                .filter(rejection -> rejection.getPhase() == phase)
                .filter(rejection -> matches(rejection.getMatch(), address))
                .findFirst();
    }

    /**
     * @throws RejectException with the configured code and message if a rejection matches
     */
    public void check(SmtpPhase phase, String address) throws RejectException {
        Optional<Rejection> rejection = find(phase, address);
        if (rejection.isPresent()) {
            throw new RejectException(rejection.get().getCode(), rejection.get().getMessage());
        }
    }

    public boolean isEmpty() {
        return rejections.isEmpty();
    }

    static boolean matches(String matcher, String address) {
        if (matcher == null || matcher.isBlank()) {
            return true;
        }
        if (address == null) {
            return false;
        }

        String normalizedMatcher = matcher.trim().toLowerCase(Locale.ROOT);
        if (normalizedMatcher.startsWith("@")) {
            return normalizedMatcher.substring(1).equals(EmailUtil.extractDomain(address));
        }
        return normalizedMatcher.equals(address.trim().toLowerCase(Locale.ROOT));
    }
}
