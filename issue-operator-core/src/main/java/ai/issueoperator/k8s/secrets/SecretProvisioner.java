/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.issueoperator.k8s.secrets;

import ai.issueoperator.k8s.CRDConstants;
import ai.issueoperator.k8s.api.crds.IssueRequestCustomResource;
import ai.issueoperator.k8s.store.CredentialStore;
import ai.issueoperator.k8s.util.KubeUtil;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Manages the per-IssueRequest secret that holds the ticketing token. The secret is created
 * empty, owned by the IssueRequest, and filled in by a human; the controller never writes to it
 * afterwards.
 */
@Slf4j
public class SecretProvisioner {

    private final CredentialStore store;
    private final String secretSuffix;
    private final String tokenKey;

    public SecretProvisioner(CredentialStore store, String secretSuffix, String tokenKey) {
        this.store = store;
        this.secretSuffix = secretSuffix;
        this.tokenKey = tokenKey;
    }

    public String secretName(IssueRequestCustomResource issueRequest) {
        return issueRequest.getMetadata().getName() + secretSuffix;
    }

    /** @return true if the secret was created by this call */
    public boolean ensureHolder(IssueRequestCustomResource issueRequest) {
        final String namespace = issueRequest.getMetadata().getNamespace();
        final String name = secretName(issueRequest);
        if (store.get(namespace, name) != null) {
            return false;
        }
        final Secret secret =
                new SecretBuilder()
                        .withNewMetadata()
                        .withName(name)
                        .withNamespace(namespace)
                        .withLabels(
                                Map.of(
                                        CRDConstants.COMMON_LABEL_APP,
                                        CRDConstants.COMMON_LABEL_APP_VALUE,
                                        CRDConstants.SECRET_LABEL_ISSUE_REQUEST,
                                        issueRequest.getMetadata().getName()))
                        .withOwnerReferences(KubeUtil.getOwnerReferenceForResource(issueRequest))
                        .endMetadata()
                        .withType("Opaque")
                        .withData(Map.of(tokenKey, ""))
                        .build();
        final boolean created = store.createIfAbsent(secret);
        if (created) {
            log.info("Created empty token secret {}/{}", namespace, name);
        }
        return created;
    }

    public TokenLookup readToken(IssueRequestCustomResource issueRequest) {
        final Secret secret =
                store.get(issueRequest.getMetadata().getNamespace(), secretName(issueRequest));
        if (secret == null) {
            return TokenLookup.notFound();
        }
        final String encoded = secret.getData() == null ? null : secret.getData().get(tokenKey);
        if (encoded == null || encoded.isBlank()) {
            return TokenLookup.empty();
        }
        final String token;
        try {
            token = new String(Base64.getDecoder().decode(encoded.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.warn(
                    "Secret {}/{} holds a value that is not valid base64, treating it as empty",
                    issueRequest.getMetadata().getNamespace(),
                    secretName(issueRequest));
            return TokenLookup.empty();
        }
        // tokens pasted with "echo | base64" carry a trailing newline
        final String trimmed = token.trim();
        return trimmed.isEmpty() ? TokenLookup.empty() : TokenLookup.present(trimmed);
    }
}
