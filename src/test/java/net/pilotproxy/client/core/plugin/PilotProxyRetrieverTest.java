package net.pilotproxy.client.core.plugin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import net.pilotproxy.client.category.TestTags;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;
import net.pilotproxy.client.core.file.LockType;
import net.pilotproxy.client.core.file.LockedFileReader;
import net.pilotproxy.client.core.proxy.PemChainDecoder;
import net.pilotproxy.client.core.proxy.ProxyCertificateGenerator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;

@Tag(TestTags.PLUGIN)
class PilotProxyRetrieverTest {
  private final LockedFileReader reader = mock(LockedFileReader.class);

  @ParameterizedTest
  @NullAndEmptySource
  void shouldFailWhenProxyVariableIsUnset(String value) {
    PilotProxyRetriever retriever =
        new PilotProxyRetriever(reader, new PemChainDecoder(), name -> value);

    PilotProxyException ex =
        assertThrows(PilotProxyException.class, () -> retriever.retrieve(LockType.NONE));
    assertEquals(ErrorCode.MISSING_PILOT_PROXY_ENV, ex.getErrorCode());
    assertEquals(ErrorCode.Kind.CONFIGURATION, ex.getErrorCode().getKind());
    verifyNoInteractions(reader);
  }

  @Test
  void shouldReadAndDecodeProxyFileFromVariable() throws Exception {
    ProxyCertificateGenerator generator = new ProxyCertificateGenerator();
    ProxyCertificateGenerator.Proxy pilot =
        generator.createRfcProxy(ProxyCertificateGenerator.INHERIT_ALL_OID);
    byte[] pem =
        ProxyCertificateGenerator.toPem(
                pilot.getCertificate(),
                pilot.getKeyPair().getPrivate(),
                generator.getUserCertificate())
            .getBytes(StandardCharsets.US_ASCII);
    when(reader.read(Paths.get("/tmp/x509up_u1000"), LockType.FLAG)).thenReturn(pem);
    PilotProxyRetriever retriever =
        new PilotProxyRetriever(
            reader,
            new PemChainDecoder(),
            name ->
                PilotProxyRetriever.X509_USER_PROXY_ENV.equals(name) ? "/tmp/x509up_u1000" : null);

    RetrievedChain retrieved = retriever.retrieve(LockType.FLAG);

    assertTrue(retrieved.isCallerOwnsRelease());
    assertEquals(pilot.getCertificate(), retrieved.getChain().getLeaf());
    assertEquals(2, retrieved.getChain().size());
  }

  @Test
  void shouldPropagateReaderErrors() throws Exception {
    when(reader.read(any(), any(LockType.class)))
        .thenThrow(new PilotProxyException(ErrorCode.TOO_MANY_RETRIES, "/tmp/p", 10));
    PilotProxyRetriever retriever =
        new PilotProxyRetriever(reader, new PemChainDecoder(), name -> "/tmp/p");

    PilotProxyException ex =
        assertThrows(PilotProxyException.class, () -> retriever.retrieve(LockType.NONE));
    assertEquals(ErrorCode.TOO_MANY_RETRIES, ex.getErrorCode());
  }
}
