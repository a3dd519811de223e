package txgate.model;

/**
 * User name and password presented by a client.
 */
public record Credentials(String user, String password) {

    @Override
    public String toString() {
        return "Credentials{user='" + user + "'}";
    }
}
