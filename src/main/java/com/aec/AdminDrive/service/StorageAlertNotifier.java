package com.aec.AdminDrive.service;

import com.aec.AdminDrive.config.AlertMailProperties;
import com.aec.AdminDrive.model.AdminCredential;
import com.aec.AdminDrive.model.QuotaWarningLevel;
import com.aec.AdminDrive.model.StorageAlert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Slf4j
@Component
public class StorageAlertNotifier {

    private final AlertMailProperties mailProps;
    private final ObjectProvider<JavaMailSender> mailSender;

    public StorageAlertNotifier(AlertMailProperties mailProps, ObjectProvider<JavaMailSender> mailSender) {
        this.mailProps = mailProps;
        this.mailSender = mailSender;
    }

    public boolean dispatch(AdminCredential credential, StorageAlert alert) {
        if (alert.getLevel() == QuotaWarningLevel.CRITICAL) {
            log.error("Storage alert [{}] credential={} account={}: {}",
                    alert.getLevel(), credential.getId(), credential.getAccountEmail(), alert.getMessage());
        } else {
            log.warn("Storage alert [{}] credential={} account={}: {}",
                    alert.getLevel(), credential.getId(), credential.getAccountEmail(), alert.getMessage());
        }
        if (mailProps.isEnabled()) {
            sendMail(credential, alert);
        }
        return true;
    }

    private void sendMail(AdminCredential credential, StorageAlert alert) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            log.warn("Alert mail enabled but no JavaMailSender is configured (spring.mail.host)");
            return;
        }
        List<String> to = mailProps.getTo() == null ? List.of()
                : mailProps.getTo().stream().filter(a -> a != null && !a.isBlank()).toList();
        if (to.isEmpty()) {
            log.warn("Alert mail enabled but admin-drive.alerts.mail.to is empty");
            return;
        }
        SimpleMailMessage msg = new SimpleMailMessage();
        if (mailProps.getFrom() != null) msg.setFrom(mailProps.getFrom());
        msg.setTo(to.toArray(String[]::new));
        msg.setSubject("[Admin Drive] Storage " + alert.getLevel().code() + " - "
                + String.format(Locale.ROOT, "%.1f", alert.getUsagePercentage()) + "% used");
        msg.setText(body(credential, alert));
        try {
            sender.send(msg);
        } catch (MailException e) {
            log.warn("Failed to mail storage alert for credential {}: {}", credential.getId(), e.getMessage());
        }
    }

    static String body(AdminCredential credential, StorageAlert alert) {
        StringBuilder sb = new StringBuilder();
        sb.append(alert.getMessage()).append("\n\n");
        sb.append("Account: ").append(credential.getAccountEmail() == null ? "-" : credential.getAccountEmail()).append('\n');
        sb.append(String.format(Locale.ROOT, "Used: %.2f GB of %.2f GB (%.2f GB available)%n",
                alert.getUsedGb(), alert.getTotalGb(), alert.getAvailableGb()));
        sb.append("Checked at: ").append(alert.getTimestamp()).append("\n\n");
        if (!alert.getRecommendations().isEmpty()) {
            sb.append("Recommendations:\n");
            alert.getRecommendations().forEach(r -> sb.append(" - ").append(r).append('\n'));
        }
        return sb.toString();
    }
}
