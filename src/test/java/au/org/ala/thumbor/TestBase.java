package au.org.ala.thumbor;

import java.net.URL;

public class TestBase {

    protected static final String SERVER = "http://thumbor.example.com";
    protected static final String SECRET = "my-secret-key";
    protected static final String TEST_IMAGE = "https://example.com/images/test.jpg";

    protected URL getResource(String filename) {
        URL url = TestBase.class.getResource(String.format("/%s", filename));
        if (url == null) {
            throw new IllegalStateException("Test resource not found: " + filename);
        }
        return url;
    }
}
