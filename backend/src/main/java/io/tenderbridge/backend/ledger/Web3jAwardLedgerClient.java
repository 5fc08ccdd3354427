package io.tenderbridge.backend.ledger;

import io.tenderbridge.backend.exception.LedgerUnavailableException;
import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;

/**
 * Award ledger backed by the TenderAward contract on an EVM chain.
 *
 * <pre>
 * recordAward(string tenderId, string winningBidId, string winningCompanyId,
 *             uint256 awardAmount, string dataHash)
 * getAward(string tenderId) returns (string, string, string, uint256, uint256, address, string)
 * event TenderAwarded(string, string, string, uint256, uint256, address, string)
 * </pre>
 */
@Component
@ConditionalOnProperty(name = "tenderbridge.ledger.provider", havingValue = "web3j")
public class Web3jAwardLedgerClient implements AwardLedgerClient {

  private static final Logger log = LoggerFactory.getLogger(Web3jAwardLedgerClient.class);

  static final Event TENDER_AWARDED =
      new Event(
          "TenderAwarded",
          Arrays.<TypeReference<?>>asList(
              new TypeReference<Utf8String>() {},
              new TypeReference<Utf8String>() {},
              new TypeReference<Utf8String>() {},
              new TypeReference<Uint256>() {},
              new TypeReference<Uint256>() {},
              new TypeReference<Address>() {},
              new TypeReference<Utf8String>() {}));

  private final Web3j web3j;
  private final Credentials credentials;
  private final PollingTransactionReceiptProcessor receiptProcessor;
  private final RawTransactionManager transactionManager;
  private final LedgerProperties.Chain chain;
  private final String eventTopic = EventEncoder.encode(TENDER_AWARDED);

  public Web3jAwardLedgerClient(Web3j web3j, LedgerProperties properties) {
    this.chain = properties.chain();
    if (chain.contractAddress() == null || chain.contractAddress().isBlank()) {
      throw new IllegalStateException("tenderbridge.ledger.chain.contract-address is required");
    }
    if (chain.privateKey() == null || chain.privateKey().isBlank()) {
      throw new IllegalStateException("tenderbridge.ledger.chain.private-key is required");
    }
    this.web3j = web3j;
    this.credentials = Credentials.create(chain.privateKey());
    this.receiptProcessor =
        new PollingTransactionReceiptProcessor(
            web3j, chain.receiptPollInterval().toMillis(), chain.receiptPollAttempts());
    this.transactionManager =
        new RawTransactionManager(web3j, credentials, chain.chainId(), receiptProcessor);
  }

  @Override
  public String providerId() {
    return "web3j";
  }

  @Override
  public LedgerCommitReceipt recordAward(AwardLedgerEntry entry) {
    var function =
        new Function(
            "recordAward",
            Arrays.<Type>asList(
                new Utf8String(entry.tenderId()),
                new Utf8String(entry.winningBidId()),
                new Utf8String(entry.winningCompanyId()),
                new Uint256(BigInteger.valueOf(entry.awardAmount())),
                new Utf8String(entry.contentHash())),
            Collections.emptyList());

    try {
      var gasPrice = web3j.ethGasPrice().send().getGasPrice();
      var sent =
          transactionManager.sendTransaction(
              gasPrice,
              BigInteger.valueOf(chain.gasLimit()),
              chain.contractAddress(),
              FunctionEncoder.encode(function),
              BigInteger.ZERO);
      if (sent.hasError()) {
        throw new LedgerUnavailableException(
            "recordAward rejected: " + sent.getError().getMessage());
      }

      TransactionReceipt receipt =
          receiptProcessor.waitForTransactionReceipt(sent.getTransactionHash());
      if (!receipt.isStatusOK()) {
        throw new LedgerUnavailableException(
            "recordAward reverted in transaction " + receipt.getTransactionHash());
      }

      log.info(
          "Recorded award for tender {} in tx {} (block {})",
          entry.tenderId(),
          receipt.getTransactionHash(),
          receipt.getBlockNumber());
      return new LedgerCommitReceipt(
          entry.contentHash(), receipt.getTransactionHash(), receipt.getBlockNumber().longValue());
    } catch (IOException | TransactionException e) {
      throw new LedgerUnavailableException("Failed to record award: " + e.getMessage(), e);
    }
  }

  @Override
  public Optional<OnChainAward> getAward(String tenderId) {
    var function =
        new Function(
            "getAward",
            Arrays.<Type>asList(new Utf8String(tenderId)),
            Arrays.<TypeReference<?>>asList(
                new TypeReference<Utf8String>() {},
                new TypeReference<Utf8String>() {},
                new TypeReference<Utf8String>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Address>() {},
                new TypeReference<Utf8String>() {}));
    try {
      var response =
          web3j
              .ethCall(
                  Transaction.createEthCallTransaction(
                      credentials.getAddress(),
                      chain.contractAddress(),
                      FunctionEncoder.encode(function)),
                  DefaultBlockParameterName.LATEST)
              .send();
      if (response.hasError() || response.isReverted()) {
        // The contract reverts for tenders it has never seen.
        log.debug("getAward({}) returned no award: {}", tenderId, response.getRevertReason());
        return Optional.empty();
      }
      List<Type> values =
          FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
      return toAward(values, LedgerQueryMethod.CONTRACT_STORAGE, null, null);
    } catch (IOException e) {
      throw new LedgerUnavailableException("Failed to read award: " + e.getMessage(), e);
    }
  }

  @Override
  public Optional<OnChainAward> getAwardByCommitRef(String commitRef) {
    try {
      var receipt = web3j.ethGetTransactionReceipt(commitRef).send().getTransactionReceipt();
      if (receipt.isEmpty()) {
        return Optional.empty();
      }
      for (Log entry : receipt.get().getLogs()) {
        if (entry.getTopics().isEmpty() || !eventTopic.equals(entry.getTopics().get(0))) {
          continue;
        }
        List<Type> values =
            FunctionReturnDecoder.decode(entry.getData(), TENDER_AWARDED.getNonIndexedParameters());
        return toAward(
            values,
            LedgerQueryMethod.TRANSACTION_LOGS,
            commitRef,
            receipt.get().getBlockNumber().longValue());
      }
      return Optional.empty();
    } catch (IOException e) {
      throw new LedgerUnavailableException("Failed to read transaction: " + e.getMessage(), e);
    }
  }

  private static Optional<OnChainAward> toAward(
      List<Type> values, LedgerQueryMethod method, String commitRef, Long blockNumber) {
    if (values.size() < 7) {
      return Optional.empty();
    }
    // Unknown keys read back as a zeroed struct; an empty hash means nothing was recorded.
    var tenderId = (String) values.get(0).getValue();
    var contentHash = (String) values.get(6).getValue();
    if (contentHash == null || contentHash.isEmpty() || tenderId == null || tenderId.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        new OnChainAward(
            tenderId,
            (String) values.get(1).getValue(),
            (String) values.get(2).getValue(),
            (BigInteger) values.get(3).getValue(),
            ((BigInteger) values.get(4).getValue()).longValue(),
            (String) values.get(5).getValue(),
            contentHash,
            method,
            commitRef,
            blockNumber));
  }
}
