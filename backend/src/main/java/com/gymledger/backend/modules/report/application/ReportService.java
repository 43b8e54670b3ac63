package com.gymledger.backend.modules.report.application;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.gymledger.backend.modules.checkin.infrastructure.CheckInRepository;
import com.gymledger.backend.modules.membership.infrastructure.MembershipRepository;
import com.gymledger.backend.modules.payment.domain.PaymentPurpose;
import com.gymledger.backend.modules.payment.domain.PaymentStatus;
import com.gymledger.backend.modules.payment.infrastructure.PaymentRepository;
import com.gymledger.backend.modules.payment.infrastructure.RevenueLine;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only projections. Rows of deleted members are counted like any other.
 */
@Service
@Transactional(readOnly = true)
public class ReportService {

    private final PaymentRepository paymentRepository;
    private final CheckInRepository checkInRepository;
    private final MembershipRepository membershipRepository;

    public ReportService(
            PaymentRepository paymentRepository,
            CheckInRepository checkInRepository,
            MembershipRepository membershipRepository
    ) {
        this.paymentRepository = paymentRepository;
        this.checkInRepository = checkInRepository;
        this.membershipRepository = membershipRepository;
    }

    public RevenueReport revenue(UUID gymId, ReportPeriod period) {
        List<RevenueLine> lines = paymentRepository.summarizeRevenue(
                gymId,
                EnumSet.of(PaymentStatus.PAID, PaymentStatus.REFUNDED),
                period.startInclusive(),
                period.endExclusive()
        );

        Map<PaymentPurpose, RevenueByPurpose> byPurpose = new EnumMap<>(PaymentPurpose.class);
        for (PaymentPurpose purpose : PaymentPurpose.values()) {
            byPurpose.put(purpose, RevenueByPurpose.empty(purpose));
        }
        for (RevenueLine line : lines) {
            byPurpose.computeIfPresent(line.purpose(), (purpose, current) -> current.add(line));
        }

        List<RevenueByPurpose> rows = new ArrayList<>(byPurpose.values());
        BigDecimal paid = rows.stream().map(RevenueByPurpose::paidTotal).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal refunded = rows.stream().map(RevenueByPurpose::refundedTotal).reduce(BigDecimal.ZERO, BigDecimal::add);
        // Refunded rows are no longer PAID, so the paid total is already net of refunds.
        return new RevenueReport(period, rows, paid.add(refunded), paid, refunded, paid);
    }

    public AttendanceReport attendance(UUID gymId, ReportPeriod period) {
        long visits = checkInRepository.countVisits(gymId, period.startInclusive(), period.endExclusive());
        long distinctMembers = checkInRepository.countDistinctMembers(gymId, period.startInclusive(), period.endExclusive());
        return new AttendanceReport(period, visits, distinctMembers);
    }

    public ChurnReport membershipChurn(UUID gymId, ReportPeriod period) {
        long started = membershipRepository.countStarted(gymId, period.from(), period.to());
        long expired = membershipRepository.countExpired(gymId, period.from(), period.to());
        long cancelled = membershipRepository.countCancelled(gymId, period.startInclusive(), period.endExclusive());
        return new ChurnReport(period, started, expired, cancelled);
    }

    public record RevenueByPurpose(
            PaymentPurpose purpose,
            BigDecimal paidTotal,
            long paidCount,
            BigDecimal refundedTotal,
            long refundedCount
    ) {

        static RevenueByPurpose empty(PaymentPurpose purpose) {
            return new RevenueByPurpose(purpose, BigDecimal.ZERO, 0, BigDecimal.ZERO, 0);
        }

        RevenueByPurpose add(RevenueLine line) {
            if (line.status() == PaymentStatus.REFUNDED) {
                return new RevenueByPurpose(purpose, paidTotal, paidCount,
                        refundedTotal.add(line.total()), refundedCount + line.count());
            }
            return new RevenueByPurpose(purpose, paidTotal.add(line.total()), paidCount + line.count(),
                    refundedTotal, refundedCount);
        }
    }

    public record RevenueReport(
            ReportPeriod period,
            List<RevenueByPurpose> byPurpose,
            BigDecimal grossTotal,
            BigDecimal paidTotal,
            BigDecimal refundedTotal,
            BigDecimal netTotal
    ) {
    }

    public record AttendanceReport(ReportPeriod period, long visits, long distinctMembers) {
    }

    public record ChurnReport(ReportPeriod period, long started, long expired, long cancelled) {
    }
}
