package org.endlesssource.scrobbler.filter;

/**
 * Decides whether media from a source application is scrobbled.
 */
public final class AppFilter {

    private AppFilter() {
    }

    /**
     * Rules, first match wins: unknown id follows {@code scrobbleUnknown}; allowed ids are allowed;
     * ignored ids are ignored; any other id asks the user when prompting is on and is allowed otherwise.
     *
     * @param appId source application id, may be null
     * @param config filter configuration
     * @return the action for this application
     */
    public static AppFilterAction classify(String appId, AppFilterConfig config) {
        if (appId == null || appId.isEmpty()) {
            return config.scrobbleUnknown() ? AppFilterAction.ALLOW : AppFilterAction.IGNORE;
        }
        if (config.allowedApps().contains(appId)) {
            return AppFilterAction.ALLOW;
        }
        if (config.ignoredApps().contains(appId)) {
            return AppFilterAction.IGNORE;
        }
        return config.promptForNewApps() ? AppFilterAction.ASK_USER : AppFilterAction.ALLOW;
    }
}
