package com.flagship.account_ledger;

import com.flagship.account_ledger.ledger.Account;
import com.flagship.account_ledger.ledger.LedgerService;
import com.flagship.account_ledger.ledger.Money;
import com.flagship.account_ledger.ledger.exception.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Start-up walkthrough of the ledger: opens two accounts on an empty ledger,
 * moves some money, and shows what a rejected transfer looks like.
 *
 * Enabled with {@code ledger.demo.enabled=true}. On a ledger restored from an
 * existing snapshot it only prints the summary.
 */
@Component
@ConditionalOnProperty(name = "ledger.demo.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class LedgerDemoRunner implements CommandLineRunner {

    private final LedgerService ledgerService;

    @Override
    public void run(String... args) {
        if (!ledgerService.getAccounts().isEmpty()) {
            log.info("Loaded existing accounts from snapshot\n{}", ledgerService.summary());
            return;
        }

        Account alice = ledgerService.createAccount("Alice", new BigDecimal("1000.00"));
        Account bob = ledgerService.createAccount("Bob", new BigDecimal("500.00"));

        ledgerService.deposit(alice.getAccountId(), new BigDecimal("250.00"), "Salary bonus");
        ledgerService.withdraw(alice.getAccountId(), new BigDecimal("100.00"), "Groceries");
        ledgerService.transfer(alice.getAccountId(), bob.getAccountId(), new BigDecimal("200.00"), "Rent payment");

        try {
            ledgerService.transfer(bob.getAccountId(), alice.getAccountId(), new BigDecimal("5000.00"));
        } catch (LedgerException e) {
            log.info("Rejected as expected: kind={}, message={}", e.getKind(), e.getMessage());
        }

        log.info("\n{}", ledgerService.statement(alice.getAccountId()));
        log.info("\n{}", ledgerService.statement(bob.getAccountId()));
        log.info("\n{}", ledgerService.summary());
        log.info("Total managed balance: {}", Money.format(ledgerService.getTotalBalance()));
    }
}
