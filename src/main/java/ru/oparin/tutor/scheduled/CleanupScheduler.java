package ru.oparin.tutor.scheduled;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import ru.oparin.tutor.config.properties.QueryProperties;
import ru.oparin.tutor.service.QueryRecordService;
import ru.oparin.tutor.service.SessionLedger;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Планировщик задач очистки: истекшие сессии и устаревшая история вопросов.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CleanupScheduler {

    private final SessionLedger sessionLedger;
    private final QueryRecordService queryRecordService;
    private final QueryProperties queryProperties;
    private final Clock clock;

    /**
     * Удаление истекших сессий каждый час
     */
    @Scheduled(cron = "${app.cleanup.sessions-cron:0 0 * * * ?}")
    public void purgeExpiredSessions() {
        log.debug("Удаление истекших сессий...");
        sessionLedger.purgeExpired(LocalDateTime.now(clock))
                .subscribe(
                        deleted -> log.info("Удалено истекших сессий: {}", deleted),
                        error -> log.error("Ошибка при удалении истекших сессий", error));
    }

    /**
     * Удаление старой истории вопросов каждый день в 03:00, если задан срок хранения
     */
    @Scheduled(cron = "${app.cleanup.query-records-cron:0 0 3 * * ?}")
    public void purgeOldQueryRecords() {
        int retentionDays = queryProperties.getRetentionDays();
        if (retentionDays <= 0) {
            log.debug("Срок хранения истории вопросов не ограничен, очистка пропущена");
            return;
        }
        LocalDateTime threshold = LocalDateTime.now(clock).minusDays(retentionDays);
        queryRecordService.purgeOlderThan(threshold)
                .subscribe(
                        deleted -> log.info("Удалено записей истории вопросов старше {} дней: {}", retentionDays, deleted),
                        error -> log.error("Ошибка при очистке истории вопросов", error));
    }
}
