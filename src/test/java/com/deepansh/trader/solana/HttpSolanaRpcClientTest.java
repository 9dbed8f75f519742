package com.deepansh.trader.solana;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpSolanaRpcClientTest {

    private static final String RPC = "https://rpc.test";

    private MockRestServiceServer server;
    private HttpSolanaRpcClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new HttpSolanaRpcClient(RPC, "confirmed", builder);
    }

    @Test
    void sendTransaction_returnsSignatureAndSendsBase64Config() {
        server.expect(requestTo(RPC))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.method").value("sendTransaction"))
                .andExpect(jsonPath("$.params[1].encoding").value("base64"))
                .andExpect(jsonPath("$.params[1].skipPreflight").value(true))
                .andExpect(jsonPath("$.params[1].maxRetries").value(5))
                .andRespond(withSuccess("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"5sig\"}", MediaType.APPLICATION_JSON));

        assertThat(client.sendTransaction("dHg=", true, 5)).isEqualTo("5sig");
        server.verify();
    }

    @Test
    void sendTransaction_resultWithoutSignature_throwsRpcExceptionWithoutCode() {
        server.expect(requestTo(RPC))
                .andRespond(withSuccess("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.sendTransaction("dHg=", false, null))
                .isInstanceOfSatisfying(RpcException.class, e -> {
                    assertThat(e.getMessage()).contains("no signature");
                    assertThat(e.getCode()).isNull();
                });
    }

    @Test
    void rpcError_carriesNodeErrorCode() {
        server.expect(requestTo(RPC))
                .andRespond(withSuccess("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32005,\"message\":\"Node is behind\"}}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.getBalanceLamports("Wallet"))
                .isInstanceOfSatisfying(RpcException.class, e -> {
                    assertThat(e.getMessage()).isEqualTo("Node is behind");
                    assertThat(e.getCode()).isEqualTo(-32005);
                });
    }
}
