package luadeob.web;

/** What the form shows after a request. {@code error} is null on success. */
record Page(String input, String output, String error) {

    static Page empty() {
        return new Page("", "", null);
    }

    static Page success(String input, String output) {
        return new Page(input, output, null);
    }

    static Page failure(String input, String error) {
        return new Page(input, "", error);
    }

    String render() {
        String alert = error == null
                ? ""
                : "<div class=\"alert alert-danger mt-3\">" + escapeHtml(error) + "</div>";

        return """
                <!DOCTYPE html>
                <html lang="en">
                <head>
                    <meta charset="UTF-8">
                    <meta name="viewport" content="width=device-width, initial-scale=1.0">
                    <title>Lua Deobfuscator</title>
                    <link href="https://cdn.jsdelivr.net/npm/bootstrap@5.3.0/dist/css/bootstrap.min.css" rel="stylesheet">
                    <style>
                        body { padding: 20px; background-color: #f8f9fa; }
                        .container { max-width: 1200px; }
                        textarea { font-family: monospace; height: 400px; }
                        .btn-submit { margin-top: 10px; }
                    </style>
                </head>
                <body>
                    <div class="container">
                        <h1 class="text-center mb-4">Lua Script Deobfuscator</h1>
                        <form method="POST">
                            <div class="row">
                                <div class="col-md-6">
                                    <h3>Input Obfuscated Code</h3>
                                    <textarea name="%s" class="form-control" placeholder="Paste your obfuscated Lua code here...">%s</textarea>
                                </div>
                                <div class="col-md-6">
                                    <h3>Deobfuscated Output</h3>
                                    <textarea class="form-control" readonly>%s</textarea>
                                </div>
                            </div>
                            %s
                            <div class="text-center">
                                <button type="submit" class="btn btn-primary btn-lg btn-submit">Deobfuscate</button>
                            </div>
                        </form>
                    </div>
                </body>
                </html>
                """.formatted(DeobfuscatorServer.INPUT_FIELD, escapeHtml(input), escapeHtml(output), alert);
    }

    static String escapeHtml(String s) {
        StringBuilder out = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
