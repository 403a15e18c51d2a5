package com.example.carerota.timeoff;

import com.example.carerota.exception.ResourceNotFoundException;
import com.example.carerota.staff.StaffMember;
import com.example.carerota.staff.StaffMemberRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Service
@Transactional
public class TimeOffService {

    private static final Logger logger = LoggerFactory.getLogger(TimeOffService.class);

    private final TimeOffRequestRepository requestRepository;
    private final StaffMemberRepository staffRepository;

    public TimeOffService(TimeOffRequestRepository requestRepository, StaffMemberRepository staffRepository) {
        this.requestRepository = requestRepository;
        this.staffRepository = staffRepository;
    }

    public TimeOffRequest submit(Long staffId, LocalDate startDate, LocalDate endDate,
                                 TimeOffRequest.Type type, String reason) {
        StaffMember staff = staffRepository.findById(staffId)
                .orElseThrow(() -> new ResourceNotFoundException("Staff member", staffId));
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("Start and end dates are required");
        }
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("End date must not be before start date");
        }
        TimeOffRequest saved = requestRepository.save(new TimeOffRequest(staff, startDate, endDate, type, reason));
        logger.info("Time off requested: id={}, staff={}, {} to {}", saved.getId(), staff.getName(), startDate, endDate);
        return saved;
    }

    public TimeOffRequest approve(Long requestId, Long approverId) {
        TimeOffRequest request = pending(requestId);
        request.setStatus(TimeOffRequest.Status.APPROVED);
        request.setDecidedBy(approverId);
        request.setDecidedAt(LocalDateTime.now());
        logger.info("Time off approved: id={}, by={}", requestId, approverId);
        return requestRepository.save(request);
    }

    public TimeOffRequest reject(Long requestId, Long approverId, String denialReason) {
        TimeOffRequest request = pending(requestId);
        request.setStatus(TimeOffRequest.Status.REJECTED);
        request.setDecidedBy(approverId);
        request.setDecidedAt(LocalDateTime.now());
        request.setDenialReason(denialReason);
        logger.info("Time off rejected: id={}, by={}", requestId, approverId);
        return requestRepository.save(request);
    }

    @Transactional(readOnly = true)
    public List<TimeOffRequest> forStaff(Long staffId) {
        return requestRepository.findByStaffMember_IdOrderByStartDateDesc(staffId);
    }

    private TimeOffRequest pending(Long requestId) {
        TimeOffRequest request = requestRepository.findById(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Time off request", requestId));
        if (request.getStatus() != TimeOffRequest.Status.PENDING) {
            throw new IllegalStateException("Time off request has already been decided");
        }
        return request;
    }
}
