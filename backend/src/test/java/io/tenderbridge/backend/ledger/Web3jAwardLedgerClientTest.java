package io.tenderbridge.backend.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.when;

import io.tenderbridge.backend.exception.LedgerUnavailableException;
import java.io.IOException;
import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

@ExtendWith(MockitoExtension.class)
class Web3jAwardLedgerClientTest {

  private static final String CONTRACT = "0x5fbdb2315678afecb367f032d93f642f64180aa3";
  private static final String POSTER = "0x90f8bf6a479f320ead074411a4b0e7944ea8c9c1";
  private static final String PRIVATE_KEY =
      "0x4f3edf983ac636a65a842ce7c78d9aa706d3b113bce9c46f30d7d21715b23b1d";
  private static final String HASH =
      "0x1f6f0a8d2c9e4b7a5d3c1e0f9b8a7c6d5e4f3a2b1c0d9e8f7a6b5c4d3e2f1a0b";

  @Mock private Web3j web3j;
  @Mock private Request<Object, EthCall> callRequest;
  @Mock private Request<Object, EthGetTransactionReceipt> receiptRequest;

  private Web3jAwardLedgerClient client;

  @BeforeEach
  void setUp() {
    client = new Web3jAwardLedgerClient(web3j, properties(CONTRACT, PRIVATE_KEY));
  }

  private static LedgerProperties properties(String contract, String privateKey) {
    var defaults = LedgerTestProperties.defaults();
    return new LedgerProperties(
        "web3j",
        2,
        900_000L,
        new LedgerProperties.Chain(
            "http://localhost:8545",
            contract,
            privateKey,
            1337L,
            1_000_000L,
            Duration.ofMillis(10),
            3),
        defaults.jobs());
  }

  private static String encodedAward(String tenderId) {
    return encodedAward(tenderId, HASH);
  }

  private static String encodedAward(String tenderId, String contentHash) {
    List<Type> values =
        List.of(
            new Utf8String(tenderId),
            new Utf8String("bid-7"),
            new Utf8String("company-3"),
            new Uint256(BigInteger.valueOf(1_250_000L)),
            new Uint256(BigInteger.valueOf(1_772_359_200L)),
            new Address(POSTER),
            new Utf8String(contentHash));
    return "0x" + FunctionEncoder.encodeConstructor(values);
  }

  @Test
  void constructor_withoutContractAddress_failsFast() {
    assertThatThrownBy(() -> new Web3jAwardLedgerClient(web3j, properties(" ", PRIVATE_KEY)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("contract-address");
  }

  @Test
  void getAward_decodesContractStorage() throws Exception {
    var response = new EthCall();
    response.setResult(encodedAward("tender-1"));
    doReturn(callRequest).when(web3j).ethCall(any(), any());
    when(callRequest.send()).thenReturn(response);

    var award = client.getAward("tender-1").orElseThrow();

    assertThat(award.tenderId()).isEqualTo("tender-1");
    assertThat(award.winningBidId()).isEqualTo("bid-7");
    assertThat(award.winningCompanyId()).isEqualTo("company-3");
    assertThat(award.awardAmount()).isEqualTo(BigInteger.valueOf(1_250_000L));
    assertThat(award.awardDate()).isEqualTo(1_772_359_200L);
    assertThat(award.awardedBy()).isEqualTo(POSTER);
    assertThat(award.contentHash()).isEqualTo(HASH);
    assertThat(award.method()).isEqualTo(LedgerQueryMethod.CONTRACT_STORAGE);
    assertThat(award.commitRef()).isNull();
  }

  @Test
  void getAward_revertedCall_meansNoAward() throws Exception {
    var response = new EthCall();
    response.setError(new Response.Error(3, "execution reverted: award not found"));
    doReturn(callRequest).when(web3j).ethCall(any(), any());
    when(callRequest.send()).thenReturn(response);

    assertThat(client.getAward("unknown")).isEmpty();
  }

  @Test
  void getAward_emptyTenderIdInStorage_meansNoAward() throws Exception {
    var response = new EthCall();
    response.setResult(encodedAward(""));
    doReturn(callRequest).when(web3j).ethCall(any(), any());
    when(callRequest.send()).thenReturn(response);

    assertThat(client.getAward("tender-1")).isEmpty();
  }

  @Test
  void getAward_emptyContentHash_meansNoAward() throws Exception {
    var response = new EthCall();
    response.setResult(encodedAward("tender-1", ""));
    doReturn(callRequest).when(web3j).ethCall(any(), any());
    when(callRequest.send()).thenReturn(response);

    assertThat(client.getAward("tender-1")).isEmpty();
  }

  @Test
  void getAward_transportFailure_throwsLedgerUnavailable() throws Exception {
    doReturn(callRequest).when(web3j).ethCall(any(), any());
    when(callRequest.send()).thenThrow(new IOException("connection refused"));

    assertThatThrownBy(() -> client.getAward("tender-1"))
        .isInstanceOf(LedgerUnavailableException.class);
  }

  @Test
  void getAwardByCommitRef_decodesTenderAwardedLog() throws Exception {
    var unrelated = new Log();
    unrelated.setTopics(List.of("0x" + "ab".repeat(32)));
    unrelated.setData("0x");
    var awarded = new Log();
    awarded.setTopics(List.of(EventEncoder.encode(Web3jAwardLedgerClient.TENDER_AWARDED)));
    awarded.setData(encodedAward("tender-1"));
    var receipt = new TransactionReceipt();
    receipt.setBlockNumber("0x2a");
    receipt.setLogs(List.of(unrelated, awarded));
    var response = new EthGetTransactionReceipt();
    response.setResult(receipt);
    doReturn(receiptRequest).when(web3j).ethGetTransactionReceipt(eq("0xtx"));
    when(receiptRequest.send()).thenReturn(response);

    var award = client.getAwardByCommitRef("0xtx").orElseThrow();

    assertThat(award.tenderId()).isEqualTo("tender-1");
    assertThat(award.method()).isEqualTo(LedgerQueryMethod.TRANSACTION_LOGS);
    assertThat(award.commitRef()).isEqualTo("0xtx");
    assertThat(award.blockNumber()).isEqualTo(42L);
  }

  @Test
  void getAwardByCommitRef_unknownTransaction_returnsEmpty() throws Exception {
    doReturn(receiptRequest).when(web3j).ethGetTransactionReceipt(eq("0xmissing"));
    when(receiptRequest.send()).thenReturn(new EthGetTransactionReceipt());

    assertThat(client.getAwardByCommitRef("0xmissing")).isEmpty();
  }
}
