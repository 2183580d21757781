package com.freelancerpro.backend.seed;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.freelancerpro.backend.dto.entry.ExpenseCreateRequest;
import com.freelancerpro.backend.dto.entry.IncomeCreateRequest;
import com.freelancerpro.backend.dto.project.ProjectCreateRequest;
import com.freelancerpro.backend.dto.project.ProjectResponseDTO;
import com.freelancerpro.backend.dto.savings.SavingsGoalCreateRequest;
import com.freelancerpro.backend.entities.User;
import com.freelancerpro.backend.enums.Currency;
import com.freelancerpro.backend.enums.ExpenseCategory;
import com.freelancerpro.backend.enums.GoalPriority;
import com.freelancerpro.backend.enums.GoalType;
import com.freelancerpro.backend.enums.IncomeCategory;
import com.freelancerpro.backend.enums.ProjectStatus;
import com.freelancerpro.backend.enums.SavingsCategory;
import com.freelancerpro.backend.repositories.UserRepository;
import com.freelancerpro.backend.security.JwtService;
import com.freelancerpro.backend.services.ExpenseService;
import com.freelancerpro.backend.services.IncomeService;
import com.freelancerpro.backend.services.ProjectService;
import com.freelancerpro.backend.services.SavingsGoalService;
import com.freelancerpro.backend.services.UserService;

/**
 * Creates a demo freelancer with a few months of records so the API has something
 * to show in development. Runs only with {@code app.seed.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "app.seed.enabled", havingValue = "true")
public class DemoDataSeedRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DemoDataSeedRunner.class);

    private record ProjectTemplate(String name, String client, String payment, ProjectStatus status, String budget) {
    }

    private static final List<ProjectTemplate> PROJECTS = List.of(
            new ProjectTemplate("E-commerce Website", "Fashion Boutique", "4500", ProjectStatus.ACTIVE, "30"),
            new ProjectTemplate("Mobile App UI", "FitnessTech", "3200", ProjectStatus.COMPLETED, "25"),
            new ProjectTemplate("Brand Identity Package", "GreenTech Solutions", "2800", ProjectStatus.ON_HOLD, "20"),
            new ProjectTemplate("Dashboard Design", "Analytics Pro", "2100", ProjectStatus.COMPLETED, "15")
    );

    private final UserRepository userRepository;
    private final UserService userService;
    private final ProjectService projectService;
    private final IncomeService incomeService;
    private final ExpenseService expenseService;
    private final SavingsGoalService savingsGoalService;
    private final JwtService jwtService;
    private final Clock clock;
    private final String demoEmail;

    public DemoDataSeedRunner(
            UserRepository userRepository,
            UserService userService,
            ProjectService projectService,
            IncomeService incomeService,
            ExpenseService expenseService,
            SavingsGoalService savingsGoalService,
            JwtService jwtService,
            Clock clock,
            @Value("${app.seed.demo-email:demo@freelancerpro.dev}") String demoEmail
    ) {
        this.userRepository = userRepository;
        this.userService = userService;
        this.projectService = projectService;
        this.incomeService = incomeService;
        this.expenseService = expenseService;
        this.savingsGoalService = savingsGoalService;
        this.jwtService = jwtService;
        this.clock = clock;
        this.demoEmail = demoEmail;
    }

    @Override
    public void run(ApplicationArguments args) {
        User user = userRepository.findByEmail(demoEmail).orElse(null);
        if (user != null) {
            logger.info("[Seed] Demo user {} already exists. Skipping.", demoEmail);
        } else {
            user = userService.createUser("Mike Chen", demoEmail, Currency.USD);
            seedRecords(user.getId());
            userService.recomputeTotals(user.getId());
            logger.info("[Seed] Demo data created for {}", demoEmail);
        }

        logger.info("[Seed] Development bearer token for {}: {}", demoEmail,
                jwtService.generateToken(user.getId(), user.getEmail()));
    }

    private void seedRecords(UUID userId) {
        LocalDateTime now = LocalDateTime.now(clock);

        for (int i = 0; i < PROJECTS.size(); i++) {
            ProjectTemplate template = PROJECTS.get(i);
            ProjectCreateRequest projectRequest = new ProjectCreateRequest();
            projectRequest.setName(template.name());
            projectRequest.setClientName(template.client());
            projectRequest.setExpectedPayment(new BigDecimal(template.payment()));
            projectRequest.setStatus(template.status());
            projectRequest.setBudgetAllocation(new BigDecimal(template.budget()));
            ProjectResponseDTO project = projectService.create(userId, projectRequest);
            UUID projectId = UUID.fromString(project.getId());

            // three monthly milestones per project
            for (int month = 0; month < 3; month++) {
                IncomeCreateRequest income = new IncomeCreateRequest();
                income.setProjectId(projectId);
                income.setAmount(new BigDecimal(template.payment()).divide(BigDecimal.valueOf(3), 2, RoundingMode.HALF_UP));
                income.setDescription("Milestone " + (month + 1) + " - " + template.name());
                income.setDate(now.minusMonths(i + month).withDayOfMonth(5));
                income.setCategory(IncomeCategory.PROJECT_PAYMENT);
                incomeService.create(userId, income);
            }

            ExpenseCreateRequest expense = new ExpenseCreateRequest();
            expense.setProjectId(projectId);
            expense.setAmount(new BigDecimal(template.payment()).multiply(new BigDecimal("0.05")));
            expense.setDescription("Tooling for " + template.name());
            expense.setDate(now.minusMonths(i).withDayOfMonth(12));
            expense.setCategory(i % 2 == 0 ? ExpenseCategory.SOFTWARE : ExpenseCategory.SUBSCRIPTIONS);
            expenseService.create(userId, expense);
        }

        savingsGoalService.create(userId, goal("Emergency Fund", "10000", "3500",
                now.plusMonths(8), SavingsCategory.EMERGENCY_FUND, GoalPriority.HIGH, GoalType.YEARLY));
        savingsGoalService.create(userId, goal("New Laptop", "2500", "1800",
                now.plusDays(5), SavingsCategory.OTHER, GoalPriority.MEDIUM, GoalType.MONTHLY));
        savingsGoalService.create(userId, goal("Summer Vacation", "3000", "3000",
                now.plusMonths(4), SavingsCategory.VACATION, GoalPriority.LOW, GoalType.MONTHLY));
    }

    private static SavingsGoalCreateRequest goal(String title, String target, String current, LocalDateTime deadline,
                                                 SavingsCategory category, GoalPriority priority, GoalType type) {
        SavingsGoalCreateRequest request = new SavingsGoalCreateRequest();
        request.setTitle(title);
        request.setTargetAmount(new BigDecimal(target));
        request.setCurrentAmount(new BigDecimal(current));
        request.setDeadline(deadline);
        request.setCategory(category);
        request.setPriority(priority);
        request.setType(type);
        return request;
    }
}
