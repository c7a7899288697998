/**
 * RemoteUser.java
 *
 * 由上游认证层确定的调用者身份。本服务不做认证，只信任上游传入的用户ID和用户名。
 */
package club.ppmc.remote.model;

import java.security.Principal;

public record RemoteUser(long id, String username) implements Principal {

    @Override
    public String getName() {
        return username;
    }
}
