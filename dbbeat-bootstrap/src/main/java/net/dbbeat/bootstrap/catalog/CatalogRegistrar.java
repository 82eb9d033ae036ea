package net.dbbeat.bootstrap.catalog;

import net.dbbeat.bootstrap.props.DbBeatProperties;
import net.dbbeat.core.model.CrontabSchedule;
import net.dbbeat.core.model.IntervalSchedule;
import net.dbbeat.core.model.IntervalUnit;
import net.dbbeat.core.model.NewPeriodicJob;
import net.dbbeat.core.model.PeriodicJob;
import net.dbbeat.core.service.PeriodicJobAdminService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 설정 파일에 선언된 주기 작업을 기동 시 DB 에 맞춰 넣는다.
 * 이름 기준 upsert. 내용이 같으면 건드리지 않아 change marker 도 움직이지 않는다.
 * 실행 통계(last fired, count)는 보존.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final PeriodicJobAdminService admin;

    public CatalogRegistrar(PeriodicJobAdminService admin) {
        this.admin = admin;
    }

    public void register(DbBeatProperties.Catalog catalog) throws Exception {
        for (var j : catalog.getJobs()) {
            upsert(j);
        }
    }

    private void upsert(DbBeatProperties.JobDef def) throws Exception {
        if (def.getName() == null || def.getTarget() == null) {
            throw new IllegalArgumentException("job.name and job.target are required");
        }
        boolean hasInterval = def.getEvery() != null || def.getUnit() != null;
        if (hasInterval == (def.getCron() != null)) {
            throw new IllegalArgumentException("job '" + def.getName() + "' needs either every/unit or cron");
        }

        // 1) schedule 확보
        IntervalSchedule interval = null;
        CrontabSchedule crontab = null;
        if (hasInterval) {
            if (def.getEvery() == null || def.getUnit() == null) {
                throw new IllegalArgumentException("job '" + def.getName() + "' needs both every and unit");
            }
            // createInterval 도 get-or-create 지만 marker 를 건드리므로 먼저 조회
            IntervalUnit unit = IntervalUnit.from(def.getUnit());
            interval = findInterval(def.getEvery(), unit).orElse(null);
            if (interval == null) interval = admin.createInterval(def.getEvery(), unit);
        } else {
            crontab = findCrontab(def.getCron()).orElse(null);
            if (crontab == null) {
                var c = def.getCron();
                crontab = admin.createCrontab(c.getMinute(), c.getHour(), c.getDayOfMonth(),
                        c.getMonthOfYear(), c.getDayOfWeek(), c.getTimezone());
            }
        }

        // 2) job upsert
        Optional<PeriodicJob> existing = admin.findJobByName(def.getName());
        if (existing.isEmpty()) {
            admin.createJob(new NewPeriodicJob(
                    def.getName(), def.getTarget(),
                    interval == null ? null : interval.id(),
                    crontab == null ? null : crontab.id(),
                    def.getArgs(), def.getKwargs(), def.getQueue(), def.getPriority(),
                    null, null, def.isOneOff(), null, def.isEnabled(), def.getDescription()));
            log.info("Catalog registered: job='{}' -> {}", def.getName(), def.getTarget());
            return;
        }

        PeriodicJob cur = existing.get();
        IntervalSchedule i = interval;
        CrontabSchedule c = crontab;
        if (sameDefinition(cur, def, i, c)) {
            log.debug("Catalog unchanged: job='{}'", def.getName());
            return;
        }
        admin.updateJob(cur.id(), j -> new PeriodicJob(
                j.id(), def.getName(), def.getTarget(), i, c,
                def.getArgs(), def.getKwargs(), def.getQueue(), def.getPriority(),
                j.expires(), j.expireSeconds(), def.isOneOff(), j.startTime(), def.isEnabled(),
                j.lastFiredAt(), j.totalFireCount(), def.getDescription(), j.createdAt(), j.updatedAt()));
        log.info("Catalog updated: job='{}' -> {}", def.getName(), def.getTarget());
    }

    private Optional<IntervalSchedule> findInterval(long every, IntervalUnit unit) throws Exception {
        return admin.listIntervals().stream()
                .filter(s -> s.every() == every && s.unit() == unit)
                .findFirst();
    }

    // crontab 은 unique 제약이 없으니 같은 패턴 행이 있으면 재사용
    private Optional<CrontabSchedule> findCrontab(DbBeatProperties.Cron cron) throws Exception {
        CrontabSchedule wanted = CrontabSchedule.ofNew(cron.getMinute(), cron.getHour(), cron.getDayOfMonth(),
                cron.getMonthOfYear(), cron.getDayOfWeek(), cron.getTimezone());
        List<CrontabSchedule> all = admin.listCrontabs();
        return all.stream()
                .filter(s -> s.toCronExpression().equals(wanted.toCronExpression()))
                .filter(s -> wanted.timezone() == null || wanted.timezone().isBlank()
                        ? Objects.equals(s.timezone(), admin.defaultZone().getId())
                        : wanted.timezone().trim().equals(s.timezone()))
                .findFirst();
    }

    private static boolean sameDefinition(PeriodicJob cur, DbBeatProperties.JobDef def,
                                          IntervalSchedule interval, CrontabSchedule crontab) {
        return Objects.equals(cur.target(), def.getTarget())
                && Objects.equals(cur.intervalId(), interval == null ? null : interval.id())
                && Objects.equals(cur.crontabId(), crontab == null ? null : crontab.id())
                && Objects.equals(cur.args(), orEmpty(def.getArgs()))
                && Objects.equals(cur.kwargs(), orEmpty(def.getKwargs()))
                && Objects.equals(cur.queue(), def.getQueue())
                && Objects.equals(cur.priority(), def.getPriority())
                && cur.oneOff() == def.isOneOff()
                && cur.enabled() == def.isEnabled()
                && Objects.equals(cur.description(), def.getDescription());
    }

    private static List<Object> orEmpty(List<Object> l) { return l == null ? List.of() : l; }
    private static Map<String, Object> orEmpty(Map<String, Object> m) { return m == null ? Map.of() : m; }
}
