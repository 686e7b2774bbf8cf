package com.microsoft.finops.budget;

import com.microsoft.finops.domain.model.Budget;
import com.microsoft.finops.domain.model.BudgetPeriod;
import com.microsoft.finops.domain.model.Money;
import com.microsoft.finops.domain.repository.BudgetRepository;
import com.microsoft.finops.exception.ConfigurationException;
import com.microsoft.finops.exception.NotFoundException;
import com.microsoft.finops.normalization.NormalizationConfigProvider;
import com.microsoft.finops.scope.ScopeExpressionParser;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Budget configuration and read-time status.
 *
 * Scope, currency and amount are validated when a budget is saved, so status
 * evaluation never meets an invalid budget. Status is recomputed on every call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetService {

    private static final BigDecimal DEFAULT_ALERT_PCT = BigDecimal.valueOf(80);

    private final BudgetRepository budgetRepository;
    private final BudgetTracker budgetTracker;
    private final NormalizationConfigProvider configProvider;
    private final Clock clock;

    @Transactional
    public Budget create(BudgetRequest request) {
        if (budgetRepository.existsByName(request.name())) {
            throw new ConfigurationException("A budget named '" + request.name() + "' already exists");
        }
        Budget budget = new Budget();
        apply(budget, request);
        Budget saved = budgetRepository.save(budget);
        log.info("Created budget '{}' ({}) over scope '{}'", saved.getName(), saved.getId(), saved.getScope());
        return saved;
    }

    @Transactional
    public Budget update(Long id, BudgetRequest request) {
        Budget budget = get(id);
        if (budgetRepository.existsByNameAndIdNot(request.name(), id)) {
            throw new ConfigurationException("A budget named '" + request.name() + "' already exists");
        }
        apply(budget, request);
        log.info("Updated budget '{}' ({})", budget.getName(), id);
        return budgetRepository.save(budget);
    }

    @Transactional
    public void delete(Long id) {
        Budget budget = get(id);
        budgetRepository.delete(budget);
        log.info("Deleted budget '{}' ({})", budget.getName(), id);
    }

    @Transactional(readOnly = true)
    public Budget get(Long id) {
        return budgetRepository.findById(id).orElseThrow(() -> new NotFoundException("Budget", id));
    }

    @Transactional(readOnly = true)
    public List<Budget> list() {
        return budgetRepository.findAllByOrderByIdAsc();
    }

    public BudgetStatus status(Long id, LocalDate asOf) {
        return budgetTracker.evaluate(get(id), asOfOrToday(asOf));
    }

    /**
     * Status of every budget, in id order.
     */
    public List<BudgetStatus> statusAll(LocalDate asOf) {
        LocalDate date = asOfOrToday(asOf);
        return list().stream()
                .map(budget -> budgetTracker.evaluate(budget, date))
                .toList();
    }

    private LocalDate asOfOrToday(LocalDate asOf) {
        return asOf != null ? asOf : LocalDate.now(clock);
    }

    private void apply(Budget budget, BudgetRequest request) {
        String orgCurrency = configProvider.current().organizationCurrency();
        String currency = request.currency() == null ? orgCurrency : request.currency().trim().toUpperCase(Locale.ROOT);
        if (!orgCurrency.equals(currency)) {
            throw new ConfigurationException("Budget currency " + currency
                    + " differs from the organization currency " + orgCurrency);
        }
        long amount = Money.toMinorUnits(request.amount(), currency);
        if (amount <= 0) {
            throw new ConfigurationException("Budget amount must be positive");
        }
        String scope = request.scope() == null ? "" : request.scope().trim();
        ScopeExpressionParser.parse(scope);

        budget.setName(request.name().trim());
        budget.setScope(scope);
        budget.setAmountMinorUnits(amount);
        budget.setCurrency(currency);
        budget.setPeriod(request.period());
        budget.setAnchorDate(request.anchorDate());
        budget.setAlertThresholdPct(request.alertThresholdPct() != null ? request.alertThresholdPct() : DEFAULT_ALERT_PCT);
    }

    /**
     * @param amount budget amount in major units of the organization currency
     */
    public record BudgetRequest(
            @NotBlank String name,
            String scope,
            @NotNull @Positive BigDecimal amount,
            String currency,
            @NotNull BudgetPeriod period,
            @NotNull LocalDate anchorDate,
            @DecimalMin(value = "0", inclusive = false) @DecimalMax("100") BigDecimal alertThresholdPct
    ) {
    }
}
