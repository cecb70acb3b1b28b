package com.dpp.audit.timestamp;

import com.dpp.audit.config.AuditProperties;
import com.dpp.audit.crypto.Digests;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cms.CMSException;
import org.bouncycastle.cms.CMSSignedData;
import org.bouncycastle.cms.jcajce.JcaSimpleSignerInfoVerifierBuilder;
import org.bouncycastle.asn1.cmp.PKIStatus;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.tsp.TSPAlgorithms;
import org.bouncycastle.tsp.TSPException;
import org.bouncycastle.tsp.TimeStampRequest;
import org.bouncycastle.tsp.TimeStampRequestGenerator;
import org.bouncycastle.tsp.TimeStampResponse;
import org.bouncycastle.tsp.TimeStampToken;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.security.cert.CertificateException;
import java.util.Collection;
import java.util.List;

/**
 * RFC 3161 client. The message imprint is {@code SHA-256(utf8(rootHash))}.
 *
 * <p>Requesting a timestamp never throws: transport errors, timeouts and
 * refused requests all come back as {@link TimestampResult#failed(String)}.
 */
@Slf4j
@Component
public class TimestampAuthorityClient {

    public static final String HASH_ALGORITHM = "sha-256";
    static final MediaType TIMESTAMP_QUERY = MediaType.parseMediaType("application/timestamp-query");
    static final MediaType TIMESTAMP_REPLY = MediaType.parseMediaType("application/timestamp-reply");

    private final RestTemplate restTemplate;
    private final String tsaUrl;
    private final SecureRandom random = new SecureRandom();

    public TimestampAuthorityClient(@Qualifier("tsaRestTemplate") RestTemplate restTemplate,
                                    AuditProperties auditProperties) {
        this.restTemplate = restTemplate;
        this.tsaUrl = auditProperties.getTsa().getUrl();
    }

    public boolean isEnabled() {
        return StringUtils.hasText(tsaUrl);
    }

    public TimestampResult requestTimestamp(String rootHash) {
        if (!isEnabled()) {
            return TimestampResult.skipped();
        }

        try {
            TimeStampRequestGenerator generator = new TimeStampRequestGenerator();
            generator.setCertReq(true);
            TimeStampRequest request = generator.generate(TSPAlgorithms.SHA256, Digests.sha256Utf8(rootHash),
                    new BigInteger(64, random));

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(TIMESTAMP_QUERY);
            headers.setAccept(List.of(TIMESTAMP_REPLY));

            ResponseEntity<byte[]> response = restTemplate.exchange(
                    tsaUrl, HttpMethod.POST, new HttpEntity<>(request.getEncoded(), headers), byte[].class);
            byte[] body = response.getBody();
            if (body == null || body.length == 0) {
                return failure(rootHash, "empty response from timestamp authority");
            }

            TimeStampResponse timeStampResponse = new TimeStampResponse(body);
            int status = timeStampResponse.getStatus();
            if (status != PKIStatus.GRANTED && status != PKIStatus.GRANTED_WITH_MODS) {
                return failure(rootHash, "timestamp request not granted, status=" + status
                        + ", detail=" + timeStampResponse.getStatusString());
            }
            timeStampResponse.validate(request);

            TimeStampToken token = timeStampResponse.getTimeStampToken();
            log.debug("Timestamp granted for Merkle root {} at {}", rootHash, token.getTimeStampInfo().getGenTime());
            return TimestampResult.granted(token.getEncoded());

        } catch (RestClientException e) {
            return failure(rootHash, "timestamp authority unreachable: " + e.getMessage());
        } catch (TSPException | IOException e) {
            return failure(rootHash, "invalid timestamp response: " + e.getMessage());
        }
    }

    /**
     * Checks that a stored token covers {@code rootHash}. When the token carries
     * the authority's certificate its signature is verified as well.
     */
    public boolean verifyTimestamp(byte[] tokenBytes, String rootHash) {
        if (tokenBytes == null || rootHash == null) {
            return false;
        }
        try {
            TimeStampToken token = new TimeStampToken(new CMSSignedData(tokenBytes));
            if (!TSPAlgorithms.SHA256.equals(token.getTimeStampInfo().getMessageImprintAlgOID())) {
                return false;
            }
            if (!MessageDigest.isEqual(Digests.sha256Utf8(rootHash), token.getTimeStampInfo().getMessageImprintDigest())) {
                return false;
            }
            Collection<X509CertificateHolder> signers = token.getCertificates().getMatches(token.getSID());
            if (!signers.isEmpty()) {
                token.validate(new JcaSimpleSignerInfoVerifierBuilder().build(signers.iterator().next()));
            }
            return true;
        } catch (CMSException | TSPException | IOException | OperatorCreationException | CertificateException
                 | IllegalArgumentException e) {
            log.warn("Timestamp token does not verify for root {}: {}", rootHash, e.getMessage());
            return false;
        }
    }

    private TimestampResult failure(String rootHash, String reason) {
        log.warn("Timestamping failed for Merkle root {}: {}", rootHash, reason);
        return TimestampResult.failed(reason);
    }
}
