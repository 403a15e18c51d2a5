package com.example.carerota.template;

import com.example.carerota.access.PersistOutcome;
import com.example.carerota.access.RotaDataAccess;
import com.example.carerota.careservice.CareService;
import com.example.carerota.careservice.CareServiceRepository;
import com.example.carerota.exception.ResourceNotFoundException;
import com.example.carerota.home.Home;
import com.example.carerota.home.HomeRepository;
import com.example.carerota.shift.Shift;
import com.example.carerota.shift.ShiftDto;
import com.example.carerota.shift.ShiftType;
import com.example.carerota.shift.ShiftValidator;
import com.example.carerota.time.TimeInterval;
import com.example.carerota.time.Weekday;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@Transactional
public class WeeklyScheduleService {

    private static final Logger logger = LoggerFactory.getLogger(WeeklyScheduleService.class);

    private final WeeklyScheduleTemplateRepository templateRepository;
    private final HomeRepository homeRepository;
    private final CareServiceRepository careServiceRepository;
    private final RotaDataAccess dataAccess;
    private final ScheduleMaterializer materializer;

    public WeeklyScheduleService(WeeklyScheduleTemplateRepository templateRepository,
                                 HomeRepository homeRepository,
                                 CareServiceRepository careServiceRepository,
                                 RotaDataAccess dataAccess,
                                 ScheduleMaterializer materializer) {
        this.templateRepository = templateRepository;
        this.homeRepository = homeRepository;
        this.careServiceRepository = careServiceRepository;
        this.dataAccess = dataAccess;
        this.materializer = materializer;
    }

    @Transactional(readOnly = true)
    public Optional<WeeklyScheduleTemplate> findTemplate(Long homeId) {
        return dataAccess.getWeeklyScheduleTemplate(homeId);
    }

    /**
     * Returns the home's template, creating the empty all-days-active default on first access.
     */
    public WeeklyScheduleTemplate getOrCreateTemplate(Long homeId) {
        Optional<WeeklyScheduleTemplate> existing = dataAccess.getWeeklyScheduleTemplate(homeId);
        if (existing.isPresent()) {
            return existing.get();
        }
        Home home = homeRepository.findById(homeId)
                .orElseThrow(() -> new ResourceNotFoundException("Home", homeId));
        WeeklyScheduleTemplate created = templateRepository.save(WeeklyScheduleTemplate.createDefault(home));
        logger.info("Created default weekly schedule for home {} (template {})", homeId, created.getId());
        return created;
    }

    public WeeklyScheduleTemplate addPattern(Long templateId, Weekday weekday, PatternCommand command) {
        WeeklyScheduleTemplate template = load(templateId);
        TimeInterval time = TimeInterval.parse(command.startTime(), command.endTime());
        ShiftValidator.validateTimes(time.start().toLocalTime(), time.end().toLocalTime());
        int staffCount = command.requiredStaffCount() == null ? 1 : command.requiredStaffCount();
        ShiftValidator.validateStaffCount(staffCount);
        if (command.serviceId() == null) {
            throw new IllegalArgumentException("Service is required");
        }
        CareService service = careServiceRepository.findById(command.serviceId())
                .orElseThrow(() -> new ResourceNotFoundException("Service", command.serviceId()));
        ShiftType type = command.shiftType() == null ? ShiftType.DAY : command.shiftType();

        template.day(weekday).addPattern(new ShiftPattern(service, time.start().toLocalTime(),
                time.end().toLocalTime(), type, staffCount, command.notes()));
        logger.info("Added {} shift {} to {} of template {}", type, time, weekday.key(), templateId);
        return templateRepository.save(template);
    }

    public WeeklyScheduleTemplate removePattern(Long templateId, Weekday weekday, int index) {
        WeeklyScheduleTemplate template = load(templateId);
        ShiftPattern removed = template.day(weekday).removePattern(index);
        logger.info("Removed shift {} from {} of template {}", removed.time(), weekday.key(), templateId);
        return templateRepository.save(template);
    }

    public WeeklyScheduleTemplate toggleDay(Long templateId, Weekday weekday) {
        WeeklyScheduleTemplate template = load(templateId);
        DaySchedule day = template.day(weekday);
        day.setActive(!day.isActive());
        logger.info("Template {} {} is now {}", templateId, weekday.key(), day.isActive() ? "active" : "inactive");
        return templateRepository.save(template);
    }

    /**
     * Shifts the template would add for the week starting at {@code weekStart}, minus
     * every slot already present for the home (soft-deleted shifts included, so a
     * deliberately removed slot is not brought back). Nothing is saved.
     */
    @Transactional(readOnly = true)
    public List<Shift> materializeWeek(Long homeId, LocalDate weekStart) {
        WeeklyScheduleTemplate template = dataAccess.getWeeklyScheduleTemplate(homeId)
                .orElseThrow(() -> new ResourceNotFoundException("Weekly schedule", homeId));
        return missingCandidates(template, weekStart);
    }

    /**
     * Materializes the week and persists the missing shifts one by one. A shift that
     * fails to save is reported and the rest are still attempted.
     */
    public MaterializationReport generateWeek(Long homeId, LocalDate weekStart) {
        WeeklyScheduleTemplate template = dataAccess.getWeeklyScheduleTemplate(homeId)
                .orElseThrow(() -> new ResourceNotFoundException("Weekly schedule", homeId));
        int requested = materializer.materialize(template, weekStart).size();
        List<Shift> missing = missingCandidates(template, weekStart);

        List<ShiftDto> created = new ArrayList<>();
        List<MaterializationReport.Failure> failures = new ArrayList<>();
        for (PersistOutcome outcome : dataAccess.persistShifts(missing)) {
            Shift shift = outcome.shift();
            if (outcome.persisted()) {
                created.add(ShiftDto.from(shift));
            } else {
                failures.add(new MaterializationReport.Failure(shift.getWorkDate(),
                        String.valueOf(shift.getStartTime()), String.valueOf(shift.getEndTime()), outcome.error()));
            }
        }
        int skipped = requested - missing.size();
        if (failures.isEmpty()) {
            logger.info("Generated week {} for home {}: {} created, {} already present",
                    weekStart, homeId, created.size(), skipped);
        } else {
            logger.warn("Generated week {} for home {}: {} of {} created, {} failed, {} already present",
                    weekStart, homeId, created.size(), missing.size(), failures.size(), skipped);
        }
        return new MaterializationReport(weekStart, requested, skipped, created, failures);
    }

    private List<Shift> missingCandidates(WeeklyScheduleTemplate template, LocalDate weekStart) {
        LocalDate weekEnd = weekStart.plusDays(ScheduleMaterializer.DAYS_PER_WEEK - 1L);
        Set<ShiftKey> present = dataAccess.getShifts(template.getHomeId(), weekStart, weekEnd).stream()
                .map(ShiftKey::of)
                .collect(Collectors.toCollection(HashSet::new));
        List<Shift> missing = new ArrayList<>();
        for (Shift candidate : materializer.materialize(template, weekStart)) {
            // add() also drops identical patterns repeated within the same day
            if (present.add(ShiftKey.of(candidate))) {
                missing.add(candidate);
            } else {
                logger.debug("Skipping existing slot {} {}", candidate.getWorkDate(), candidate.interval());
            }
        }
        return missing;
    }

    private WeeklyScheduleTemplate load(Long templateId) {
        return templateRepository.findById(templateId)
                .orElseThrow(() -> new ResourceNotFoundException("Weekly schedule", templateId));
    }

    public record PatternCommand(Long serviceId,
                                 String startTime,
                                 String endTime,
                                 ShiftType shiftType,
                                 Integer requiredStaffCount,
                                 String notes) {}
}
