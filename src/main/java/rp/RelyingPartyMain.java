package rp;

import config.SystemConfig;
import keys.KeySetProvider;
import network.HttpKeySetFetcher;
import storage.RedisKeySetStore;
import token.TokenClaims;
import verifier.GoogleIdTokenVerifier;
import verifier.TokenVerificationException;

import java.time.Clock;

/**
 * Verifies one Google ID token from the command line.
 * <pre>
 * RelyingPartyMain &lt;client-id&gt; &lt;id-token&gt; [--redis]
 * </pre>
 * With {@code --redis} the fetched key set is shared through the configured Redis server.
 */
public class RelyingPartyMain {

    public static void main(String[] args) {
        if (args.length < 2 || args.length > 3 || (args.length == 3 && !"--redis".equals(args[2]))) {
            System.err.println("Usage: RelyingPartyMain <client-id> <id-token> [--redis]");
            System.exit(2);
        }
        String clientId = args[0];
        String idToken = args[1];
        boolean useRedis = args.length == 3;

        int status = 0;
        RedisKeySetStore store = useRedis ? RedisKeySetStore.connect(SystemConfig.KEY_SET_NAME) : null;
        try {
            KeySetProvider provider = new KeySetProvider(HttpKeySetFetcher.forGoogle(), store,
                    SystemConfig.KEY_SET_CACHE_TTL_SECONDS);
            RelyingParty rp = new RelyingParty(clientId, provider, new GoogleIdTokenVerifier(), Clock.systemUTC());

            TokenClaims claims = rp.authenticate(idToken);
            System.out.println("✅ Token is valid.");
            System.out.println("  - sub:            " + claims.getSub());
            System.out.println("  - email:          " + claims.getEmail());
            System.out.println("  - email_verified: " + claims.isEmailVerified());
            System.out.println("  - name:           " + claims.getName());
            System.out.println("  - iss:            " + claims.getIss());
            System.out.println("  - aud:            " + claims.getAud());
            System.out.println("  - iat / exp:      " + claims.getIat() + " / " + claims.getExp());
        } catch (TokenVerificationException e) {
            System.err.println("❌ " + e.getError() + ": " + e.getMessage());
            status = 1;
        } catch (Exception e) {
            System.err.println("❌ Verification could not run: " + e.getMessage());
            e.printStackTrace();
            status = 1;
        } finally {
            if (store != null) {
                store.close();
            }
        }
        System.exit(status);
    }
}
