package com.example.carerota.access;

import com.example.carerota.shift.Shift;
import com.example.carerota.shift.ShiftRepository;
import com.example.carerota.shift.ShiftValidator;
import com.example.carerota.template.WeeklyScheduleTemplate;
import com.example.carerota.template.WeeklyScheduleTemplateRepository;
import com.example.carerota.timeoff.TimeOffRequest;
import com.example.carerota.timeoff.TimeOffRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
public class JpaRotaDataAccess implements RotaDataAccess {

    private static final Logger logger = LoggerFactory.getLogger(JpaRotaDataAccess.class);

    private final ShiftRepository shiftRepository;
    private final TimeOffRequestRepository timeOffRepository;
    private final WeeklyScheduleTemplateRepository templateRepository;

    public JpaRotaDataAccess(ShiftRepository shiftRepository,
                             TimeOffRequestRepository timeOffRepository,
                             WeeklyScheduleTemplateRepository templateRepository) {
        this.shiftRepository = shiftRepository;
        this.timeOffRepository = timeOffRepository;
        this.templateRepository = templateRepository;
    }

    @Override
    public List<Shift> getShifts(Long homeId, LocalDate from, LocalDate to) {
        return shiftRepository.findByHome_IdAndWorkDateBetweenOrderByWorkDateAscStartTimeAsc(homeId, from, to);
    }

    @Override
    public List<Shift> getShiftsForStaff(Long staffId, LocalDate from, LocalDate to) {
        return shiftRepository.findActiveAssignedToStaff(staffId, from, to);
    }

    @Override
    public List<TimeOffRequest> getApprovedTimeOff(Long staffId, LocalDate from, LocalDate to) {
        return timeOffRepository.findIntersecting(staffId, TimeOffRequest.Status.APPROVED, from, to);
    }

    @Override
    public Optional<WeeklyScheduleTemplate> getWeeklyScheduleTemplate(Long homeId) {
        return templateRepository.findByHome_Id(homeId);
    }

    /**
     * Validates and saves each shift in the caller's transaction. A shift that fails
     * validation is reported and skipped; database errors still fail the whole call.
     */
    @Override
    public List<PersistOutcome> persistShifts(List<Shift> shifts) {
        List<PersistOutcome> outcomes = new ArrayList<>(shifts.size());
        for (Shift shift : shifts) {
            try {
                ShiftValidator.validate(shift);
                outcomes.add(PersistOutcome.ok(shiftRepository.save(shift)));
            } catch (IllegalArgumentException e) {
                logger.warn("Failed to persist shift {}-{} on {}: {}", shift.getStartTime(), shift.getEndTime(), shift.getWorkDate(), e.getMessage());
                outcomes.add(PersistOutcome.failed(shift, e.getMessage()));
            }
        }
        return outcomes;
    }
}
