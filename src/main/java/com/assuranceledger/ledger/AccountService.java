package com.assuranceledger.ledger;

import com.assuranceledger.common.Money;
import com.assuranceledger.common.TypeCodes;
import com.assuranceledger.common.exception.AccountNotFoundException;
import com.assuranceledger.common.exception.ConcurrencyConflictException;
import com.assuranceledger.common.exception.InvalidStateException;
import com.assuranceledger.common.exception.NotFoundException;
import com.assuranceledger.common.exception.ValidationException;
import com.assuranceledger.contracts.CommitmentContract;
import com.assuranceledger.contracts.CommitmentContractRepository;
import com.assuranceledger.subjects.SubjectRef;
import com.assuranceledger.subjects.SubjectRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service for secured balance account lifecycle.
 *
 * Balances are never written here; they only move through {@link LedgerService#post}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final SecuredBalanceAccountRepository accountRepository;
    private final CommitmentContractRepository contractRepository;
    private final SubjectRegistry subjectRegistry;

    @Transactional
    public SecuredBalanceAccount open(OpenAccountCommand command) {
        String customTypeCode = TypeCodes.requireCustomCode("accountType", command.getAccountType(),
            command.getCustomTypeCode());
        SubjectRef owner = subjectRegistry.require(command.getTenantId(), "ownerSubject", command.getOwnerSubject());
        SubjectRef counterparty = subjectRegistry.requireIfPresent(command.getTenantId(), "counterpartySubject",
            command.getCounterpartySubject());

        String currency = command.getCurrency();
        if (command.getContractId() != null) {
            CommitmentContract contract = contractRepository
                .findByTenantIdAndIdForUpdate(command.getTenantId(), command.getContractId())
                .orElseThrow(() -> new NotFoundException("Contract", command.getContractId()));
            if (contract.isTerminal()) {
                throw new InvalidStateException("contract", contract.getId(), contract.getStatus().name(),
                    "open account");
            }
            if (currency == null) {
                currency = contract.getCurrency();
            } else if (!currency.equals(contract.getCurrency())) {
                throw new ValidationException("currency", String.format("contract %s is in %s, account requested in %s",
                    contract.getId(), contract.getCurrency(), currency));
            }
            accountRepository.findByTenantIdAndContractId(command.getTenantId(), contract.getId())
                .ifPresent(existing -> {
                    throw new ValidationException("contractId",
                        "contract " + contract.getId() + " already has account " + existing.getId());
                });
        }
        Money.requireCurrency(currency);

        SecuredBalanceAccount account = new SecuredBalanceAccount(command.getTenantId(), command.getContractId(),
            command.getAccountType(), customTypeCode, currency, owner, counterparty);
        try {
            account = accountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException e) {
            throw new ConcurrencyConflictException("contract " + command.getContractId()
                + " got an account from a concurrent request", e);
        }

        log.info("Opened {} account {} for contract {} owned by {}",
            account.getAccountType(), account.getId(), account.getContractId(), owner);

        return account;
    }

    @Transactional(readOnly = true)
    public SecuredBalanceAccount get(String tenantId, String accountId) {
        return accountRepository.findByTenantIdAndId(tenantId, accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    @Transactional(readOnly = true)
    public SecuredBalanceAccount getForContract(String tenantId, String contractId) {
        return accountRepository.findByTenantIdAndContractId(tenantId, contractId)
            .orElseThrow(() -> AccountNotFoundException.forContract(contractId));
    }

    @Transactional(readOnly = true)
    public List<SecuredBalanceAccount> listByOwner(String tenantId, SubjectRef owner) {
        return accountRepository.findByOwner(tenantId, owner.getKind(), owner.getId());
    }

    /**
     * Close an account that no longer holds anything.
     */
    @Transactional
    public SecuredBalanceAccount close(String tenantId, String accountId) {
        String contractId = accountRepository.findContractIdByTenantIdAndId(tenantId, accountId).orElse(null);
        if (contractId != null) {
            contractRepository.findByTenantIdAndIdForUpdate(tenantId, contractId)
                .orElseThrow(() -> new NotFoundException("Contract", contractId));
        }
        SecuredBalanceAccount account = accountRepository.findByTenantIdAndIdForUpdate(tenantId, accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
        account.close();
        account = accountRepository.save(account);

        log.info("Closed account {} with balance {}", accountId, Money.of(account.getBalance(), account.getCurrency()));
        return account;
    }
}
